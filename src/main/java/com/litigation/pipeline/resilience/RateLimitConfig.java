package com.litigation.pipeline.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Rate limit of one external provider.
 *
 * @param permitsPerWindow maximum calls started within any window of length {@code window}
 * @param window           length of the sliding window
 */
public record RateLimitConfig(int permitsPerWindow, Duration window) {

    public RateLimitConfig {
        Objects.requireNonNull(window, "window is required");
        if (permitsPerWindow <= 0) {
            throw new IllegalArgumentException("permitsPerWindow must be > 0");
        }
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    /**
     * Default rate limit: 10 calls per second.
     */
    public static RateLimitConfig defaults() {
        return new RateLimitConfig(10, Duration.ofSeconds(1));
    }
}
