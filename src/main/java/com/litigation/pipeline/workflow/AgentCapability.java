package com.litigation.pipeline.workflow;

/**
 * What an agent can do. The orchestrator dispatches tasks by capability only.
 */
public enum AgentCapability {
    INTAKE,
    OUTLINE,
    RESEARCH,
    DRAFTING,
    REVIEW,
    EDITING
}
