package com.litigation.pipeline.workflow;

public enum TaskStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
