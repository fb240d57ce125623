package com.litigation.pipeline.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts    total attempts including the first
 * @param initialBackoff delay before the second attempt
 * @param multiplier     growth factor between consecutive delays
 * @param maxBackoff     upper bound on any single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff is required");
        Objects.requireNonNull(maxBackoff, "maxBackoff is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default: 3 attempts, 100ms doubling up to 2s.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), 2.0, Duration.ofSeconds(2));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    public Duration backoffFor(int failedAttempt) {
        if (failedAttempt < 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean canRetry(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
