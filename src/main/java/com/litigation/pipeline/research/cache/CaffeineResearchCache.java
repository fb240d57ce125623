package com.litigation.pipeline.research.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.litigation.pipeline.research.ResearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed research cache.
 *
 * <p>Caffeine evicts entries after the stale retention period; freshness within that
 * period is decided against each entry's own TTL so an expired entry stays available as
 * a stale fallback.</p>
 */
public class CaffeineResearchCache implements ResearchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResearchCache.class);

    private final Cache<String, CachedResearch> cache;
    private final Duration ttl;
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public CaffeineResearchCache(ResearchCacheConfig config) {
        this.ttl = Duration.ofSeconds(config.ttlSeconds());
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.staleRetentionSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineResearchCache initialized: maxSize={}, ttl={}s, staleRetention={}s",
                config.maxSize(), config.ttlSeconds(), config.staleRetentionSeconds());
    }

    @Override
    public Optional<CachedResearch> getFresh(String fingerprint, Instant now) {
        CachedResearch entry = cache.getIfPresent(fingerprint);
        if (entry != null && entry.isFreshAt(now)) {
            hits.increment();
            return Optional.of(entry);
        }
        misses.increment();
        return Optional.empty();
    }

    @Override
    public Optional<CachedResearch> getAny(String fingerprint) {
        return Optional.ofNullable(cache.getIfPresent(fingerprint));
    }

    @Override
    public CachedResearch put(String fingerprint, ResearchResult result, Instant now) {
        CachedResearch entry = new CachedResearch(result, now, ttl);
        cache.put(fingerprint, entry);
        log.debug("research.cache.put fingerprint={} citations={}", fingerprint, result.citations().size());
        return entry;
    }

    @Override
    public void invalidate(String fingerprint) {
        cache.invalidate(fingerprint);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all research cache entries");
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(hits.sum(), misses.sum(), cache.stats().evictionCount(), cache.estimatedSize());
    }

    @Override
    public Duration getTtl() {
        return ttl;
    }
}
