package com.litigation.pipeline.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared by every task and provider call of one
 * workflow session.
 *
 * <p>Work never gets interrupted from the outside: long-running code checks
 * {@link #isCancelled()} (or calls {@link #throwIfCancelled()}) at its checkpoints
 * and stops on its own.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final boolean cancellable;
    private volatile String reason;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled, for calls not tied to a session.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Signals cancellation. Only the first call has an effect.
     *
     * @return true if this call cancelled the token
     */
    public boolean cancel(String reason) {
        if (!cancellable || !cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            callback.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * Registers a callback run once on cancellation, or immediately if the token
     * is already cancelled.
     *
     * @return a registration whose {@code close()} removes the callback once it is no longer needed
     */
    public Registration onCancel(Runnable callback) {
        if (!cancellable) {
            return Registration.NONE;
        }
        AtomicBoolean ran = new AtomicBoolean(false);
        Runnable once = () -> {
            if (ran.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        if (isCancelled()) {
            once.run();
        }
        return () -> callbacks.remove(once);
    }

    int registeredCallbacks() {
        return callbacks.size();
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new OperationCancelledException(reason != null ? reason : "cancelled");
        }
    }

    /**
     * Handle on a registered cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        Registration NONE = () -> { };

        @Override
        void close();
    }
}
