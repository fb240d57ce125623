package com.litigation.pipeline.core.model;

import java.util.Objects;

/**
 * Where an observation came from. Foundational sources receive a one-time
 * confidence boost at ingestion.
 *
 * @param source       identifier of the contributing agent, document or provider
 * @param foundational whether the source is a designated higher-trust channel
 */
public record Provenance(String source, boolean foundational) {

    public Provenance {
        Objects.requireNonNull(source, "source is required");
    }

    public static Provenance of(String source) {
        return new Provenance(source, false);
    }

    public static Provenance foundational(String source) {
        return new Provenance(source, true);
    }
}
