package com.litigation.pipeline.audit;

/**
 * Auditable actions in the pipeline.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_UPDATED,
    RELATIONSHIP_CREATED,
    RELATIONSHIP_FLAGGED,
    CONFIDENCE_DECAYED,
    SESSION_STARTED,
    PHASE_ADVANCED,
    APPROVAL_REQUESTED,
    APPROVAL_GRANTED,
    TASK_FAILED,
    PHASE_RETRIED,
    SESSION_CANCELLED,
    SESSION_RETIRED
}
