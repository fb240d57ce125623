package com.litigation.pipeline.research;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Citation as returned by a provider, before ranking.
 *
 * @param sourceType explicit source type, or null to classify from {@code court}
 */
public record RawCitation(String sourceId, String title, String court, String jurisdictionId,
                          LocalDate decisionDate, String snippet, SourceType sourceType) {

    public RawCitation {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(title, "title is required");
        snippet = snippet != null ? snippet : "";
    }

    public static RawCitation of(String sourceId, String title, String court, String jurisdictionId,
                                 LocalDate decisionDate, String snippet) {
        return new RawCitation(sourceId, title, court, jurisdictionId, decisionDate, snippet, null);
    }

    public SourceType resolvedSourceType() {
        return sourceType != null ? sourceType : SourceType.fromCourtName(court);
    }
}
