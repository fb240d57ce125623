package com.litigation.pipeline.lock;

/**
 * Configuration for per-key locks.
 *
 * @param timeoutMs maximum time a writer waits for the lock on a key
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }
}
