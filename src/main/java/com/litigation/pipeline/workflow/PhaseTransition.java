package com.litigation.pipeline.workflow;

import java.time.Instant;

/**
 * One entry of a session's phase history.
 */
public record PhaseTransition(WorkflowPhase from, WorkflowPhase to, Instant at, String actorId) {
}
