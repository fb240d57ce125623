package com.litigation.pipeline.research;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for research execution.
 *
 * @param providerTimeout      maximum duration of one provider call
 * @param rateLimitMaxWait     how long a call waits for its provider's rate limiter
 * @param recencyHorizonYears  citations older than this do not count as recent
 * @param maxCitations         citations kept per result after ranking
 * @param writeToGraph         whether fresh results are written to the knowledge graph
 */
public record ResearchOptions(Duration providerTimeout, Duration rateLimitMaxWait, int recencyHorizonYears,
                              int maxCitations, boolean writeToGraph) {

    public ResearchOptions {
        Objects.requireNonNull(providerTimeout, "providerTimeout is required");
        Objects.requireNonNull(rateLimitMaxWait, "rateLimitMaxWait is required");
        if (providerTimeout.isZero() || providerTimeout.isNegative()) {
            throw new IllegalArgumentException("providerTimeout must be positive");
        }
        if (rateLimitMaxWait.isNegative()) {
            throw new IllegalArgumentException("rateLimitMaxWait must not be negative");
        }
        if (recencyHorizonYears <= 0) {
            throw new IllegalArgumentException("recencyHorizonYears must be > 0");
        }
        if (maxCitations <= 0) {
            throw new IllegalArgumentException("maxCitations must be > 0");
        }
    }

    public static ResearchOptions defaults() {
        return new ResearchOptions(Duration.ofSeconds(10), Duration.ofSeconds(2), 10, 25, true);
    }
}
