package com.litigation.pipeline.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion per key. Writers to the same key are serialized while writers to
 * different keys proceed in parallel.
 */
public interface KeyedLock {

    /**
     * Acquires the lock on the given key.
     *
     * @throws LockAcquisitionException if the lock is not acquired within the timeout
     */
    void lock(String key);

    /**
     * Releases the lock on the given key if held by the current thread.
     */
    void unlock(String key);

    /**
     * Runs the action while holding the lock on the key.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
