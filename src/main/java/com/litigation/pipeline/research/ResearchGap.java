package com.litigation.pipeline.research;

import java.util.Objects;

/**
 * Coverage weakness found in a research result, with what to do about it.
 */
public record ResearchGap(Type type, String description, String recommendation) {

    public enum Type {
        /** No citation applies to the query jurisdiction. */
        MISSING_JURISDICTION,
        /** No citation falls within the recency horizon. */
        INSUFFICIENT_RECENCY,
        /** No citation at authority level 2 or better. */
        AUTHORITY_THIN,
        /** A legal issue of the query is not mentioned by any citation. */
        UNCOVERED_ISSUE
    }

    public ResearchGap {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(description, "description is required");
        Objects.requireNonNull(recommendation, "recommendation is required");
    }
}
