package com.litigation.pipeline.workflow;

import java.util.List;
import java.util.Objects;

/**
 * Which capabilities work in a phase and whether leaving it needs human approval.
 */
public record PhaseDefinition(WorkflowPhase phase, List<AgentCapability> capabilities, boolean approvalRequired) {

    public PhaseDefinition {
        Objects.requireNonNull(phase, "phase is required");
        capabilities = capabilities != null ? List.copyOf(capabilities) : List.of();
    }

    public static PhaseDefinition of(WorkflowPhase phase, AgentCapability capability) {
        return new PhaseDefinition(phase, List.of(capability), false);
    }

    public static PhaseDefinition gated(WorkflowPhase phase, AgentCapability capability) {
        return new PhaseDefinition(phase, List.of(capability), true);
    }
}
