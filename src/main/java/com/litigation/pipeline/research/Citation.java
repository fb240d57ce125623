package com.litigation.pipeline.research;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Ranked citation. The authority level is fixed by the source type; the relevance score
 * belongs to the query it was computed for.
 *
 * @param cachedAt when the result holding this citation was cached, null if never cached
 * @param ttl      cache time-to-live, null if never cached
 */
public record Citation(String sourceId, String title, String court, String jurisdictionId,
                       LocalDate decisionDate, String snippet, int authorityLevel, double relevanceScore,
                       String providerName, Instant cachedAt, Duration ttl) {

    public Citation {
        Objects.requireNonNull(sourceId, "sourceId is required");
        if (authorityLevel < 1 || authorityLevel > 5) {
            throw new IllegalArgumentException("authorityLevel must be in [1, 5], got " + authorityLevel);
        }
        if (relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new IllegalArgumentException("relevanceScore must be in [0, 1], got " + relevanceScore);
        }
    }

    public static Citation from(RawCitation raw, String providerName, double relevanceScore) {
        return new Citation(raw.sourceId(), raw.title(), raw.court(), raw.jurisdictionId(), raw.decisionDate(),
                raw.snippet(), raw.resolvedSourceType().getAuthorityLevel(), relevanceScore, providerName,
                null, null);
    }

    public Citation cached(Instant at, Duration timeToLive) {
        return new Citation(sourceId, title, court, jurisdictionId, decisionDate, snippet, authorityLevel,
                relevanceScore, providerName, at, timeToLive);
    }
}
