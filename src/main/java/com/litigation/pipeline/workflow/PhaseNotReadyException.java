package com.litigation.pipeline.workflow;

/**
 * Thrown when a session cannot leave its current phase yet: tasks are outstanding or a required approval is missing.
 */
public class PhaseNotReadyException extends RuntimeException {

    public PhaseNotReadyException(String message) {
        super(message);
    }
}
