package com.litigation.pipeline.workflow;

/**
 * A task of the phase exhausted its retries. The phase stays in error until retried or the session is cancelled.
 */
public class PhaseFailedException extends RuntimeException {

    public PhaseFailedException(String message) {
        super(message);
    }
}
