package com.litigation.pipeline.core;

/**
 * Thrown when work observes a cancelled {@link CancellationToken} at a checkpoint.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
