package com.litigation.pipeline.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Validity interval of a relationship. {@code end} is null while the relationship
 * is still in force.
 */
public record TemporalValidity(Instant start, Instant end) {

    public TemporalValidity {
        Objects.requireNonNull(start, "start is required");
    }

    public static TemporalValidity from(Instant start) {
        return new TemporalValidity(start, null);
    }

    public boolean isOpenEnded() {
        return end == null;
    }
}
