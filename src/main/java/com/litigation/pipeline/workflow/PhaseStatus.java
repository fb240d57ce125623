package com.litigation.pipeline.workflow;

/**
 * Status of one phase within a session.
 */
public enum PhaseStatus {
    /** Entered but tasks not dispatched yet. */
    PENDING,
    IN_PROGRESS,
    /** Every task completed; the phase still needs human approval. */
    AWAITING_APPROVAL,
    /** Every task completed and nothing blocks advancing. */
    TASKS_COMPLETE,
    /** The session has advanced past this phase. */
    COMPLETED,
    /** A task exhausted its retries. */
    ERROR,
    CANCELLED
}
