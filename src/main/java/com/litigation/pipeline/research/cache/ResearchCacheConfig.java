package com.litigation.pipeline.research.cache;

/**
 * Configuration for the research cache.
 *
 * @param maxSize               maximum number of cached query results
 * @param ttlSeconds            how long a result is served as fresh
 * @param staleRetentionSeconds how long a result is kept for stale fallback, at least {@code ttlSeconds}
 * @param enabled               whether caching is enabled
 */
public record ResearchCacheConfig(int maxSize, int ttlSeconds, int staleRetentionSeconds, boolean enabled) {

    public ResearchCacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
        if (staleRetentionSeconds < ttlSeconds) {
            throw new IllegalArgumentException("staleRetentionSeconds must be >= ttlSeconds");
        }
    }

    /**
     * Default: 1,000 results, 1h TTL, kept 7 days for stale fallback.
     */
    public static ResearchCacheConfig defaults() {
        return new ResearchCacheConfig(1_000, 3_600, 7 * 24 * 3_600, true);
    }

    public static ResearchCacheConfig disabled() {
        return new ResearchCacheConfig(1, 1, 1, false);
    }
}
