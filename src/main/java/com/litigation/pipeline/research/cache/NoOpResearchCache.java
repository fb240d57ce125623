package com.litigation.pipeline.research.cache;

import com.litigation.pipeline.research.ResearchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpResearchCache implements ResearchCache {

    @Override
    public Optional<CachedResearch> getFresh(String fingerprint, Instant now) {
        return Optional.empty();
    }

    @Override
    public Optional<CachedResearch> getAny(String fingerprint) {
        return Optional.empty();
    }

    @Override
    public CachedResearch put(String fingerprint, ResearchResult result, Instant now) {
        return new CachedResearch(result, now, Duration.ZERO);
    }

    @Override
    public void invalidate(String fingerprint) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }

    @Override
    public Duration getTtl() {
        return null;
    }
}
