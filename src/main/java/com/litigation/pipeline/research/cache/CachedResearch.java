package com.litigation.pipeline.research.cache;

import com.litigation.pipeline.research.ResearchResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached research result with its TTL.
 */
public record CachedResearch(ResearchResult result, Instant cachedAt, Duration ttl) {

    public CachedResearch {
        Objects.requireNonNull(result, "result is required");
        Objects.requireNonNull(cachedAt, "cachedAt is required");
        Objects.requireNonNull(ttl, "ttl is required");
    }

    public Instant expiresAt() {
        return cachedAt.plus(ttl);
    }

    public boolean isFreshAt(Instant now) {
        return now.isBefore(expiresAt());
    }
}
