package com.litigation.pipeline.research;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one research query. Callers check {@code stale} and
 * {@code insufficientCoverage} before relying on the citations.
 *
 * @param sourceProvider        provider that produced the citations, null for an empty result
 * @param stale                 served from a cache entry past its TTL because every provider failed
 * @param insufficientCoverage  no provider succeeded and nothing was cached
 * @param servedFromCache       served from a cache entry
 * @param confidence            overall research confidence in [0, 1]
 */
public record ResearchResult(String queryFingerprint, String jurisdictionId, List<Citation> citations,
                             String sourceProvider, boolean stale, boolean insufficientCoverage,
                             boolean servedFromCache, List<ResearchGap> gapsIdentified, double confidence,
                             List<ResearchStage.Transition> trail, Instant completedAt) {

    public ResearchResult {
        Objects.requireNonNull(queryFingerprint, "queryFingerprint is required");
        citations = citations != null ? List.copyOf(citations) : List.of();
        gapsIdentified = gapsIdentified != null ? List.copyOf(gapsIdentified) : List.of();
        trail = trail != null ? List.copyOf(trail) : List.of();
    }

    public boolean hasGap(ResearchGap.Type type) {
        return gapsIdentified.stream().anyMatch(gap -> gap.type() == type);
    }

    /**
     * Copy of this result as served from the cache.
     */
    public ResearchResult fromCache(boolean markStale, List<ResearchStage.Transition> servingTrail) {
        return new ResearchResult(queryFingerprint, jurisdictionId, citations, sourceProvider, markStale,
                insufficientCoverage, true, gapsIdentified, confidence, servingTrail, completedAt);
    }
}
