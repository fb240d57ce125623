package com.litigation.pipeline.workflow;

public enum SessionStatus {
    ACTIVE,
    /** Reached the terminal phase; retired. */
    COMPLETED,
    /** Cancelled before completion; retired. */
    ABANDONED
}
