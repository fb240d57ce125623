package com.litigation.pipeline.core.model;

import java.time.Instant;

/**
 * Validity window of an entity. Either bound may be null (open).
 */
public record TemporalContext(Instant validFrom, Instant validTo) {

    public TemporalContext {
        if (validFrom != null && validTo != null && validTo.isBefore(validFrom)) {
            throw new IllegalArgumentException("validTo must not be before validFrom");
        }
    }

    public static TemporalContext until(Instant validTo) {
        return new TemporalContext(null, validTo);
    }

    public boolean isExpiredAt(Instant now) {
        return validTo != null && validTo.isBefore(now);
    }
}
