package com.litigation.pipeline.workflow;

/**
 * Fixed sequence of phases a session moves through. {@link #DONE} is terminal.
 */
public enum WorkflowPhase {
    INTAKE,
    OUTLINE,
    RESEARCH,
    DRAFTING,
    REVIEW,
    EDITING,
    DONE;

    public boolean isTerminal() {
        return this == DONE;
    }

    /**
     * The phase that follows this one.
     *
     * @throws IllegalStateException if this phase is terminal
     */
    public WorkflowPhase next() {
        if (isTerminal()) {
            throw new IllegalStateException("DONE has no next phase");
        }
        return values()[ordinal() + 1];
    }
}
