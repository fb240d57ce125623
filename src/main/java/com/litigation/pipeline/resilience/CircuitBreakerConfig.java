package com.litigation.pipeline.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * @param failureThreshold consecutive failures that open the circuit
 * @param cooldown         how long an open circuit rejects calls before allowing a trial call
 */
public record CircuitBreakerConfig(int failureThreshold, Duration cooldown) {

    public CircuitBreakerConfig {
        Objects.requireNonNull(cooldown, "cooldown is required");
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be > 0");
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative");
        }
    }

    /**
     * Default: open after 3 consecutive failures, 30s cooldown.
     */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(3, Duration.ofSeconds(30));
    }
}
