package com.litigation.pipeline.research.cache;

import com.litigation.pipeline.research.ResearchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache of research results keyed by query fingerprint.
 *
 * <p>Implementations must be thread-safe: lookups never block each other and writes
 * lock only the key being written.</p>
 */
public interface ResearchCache {

    /**
     * Returns the entry for the fingerprint only if it is within its TTL at {@code now}.
     */
    Optional<CachedResearch> getFresh(String fingerprint, Instant now);

    /**
     * Returns the entry for the fingerprint whether or not its TTL has passed, for
     * stale fallback when no provider is available.
     */
    Optional<CachedResearch> getAny(String fingerprint);

    CachedResearch put(String fingerprint, ResearchResult result, Instant now);

    void invalidate(String fingerprint);

    void invalidateAll();

    CacheStats getStats();

    /**
     * TTL applied to new entries, or null when nothing is cached.
     */
    Duration getTtl();
}
