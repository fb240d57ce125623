package com.litigation.pipeline.research.cache;

/**
 * Research cache statistics. A hit is a fresh entry served; stale entries served as a
 * fallback are not counted as hits.
 *
 * @param hitCount      fresh lookups that found an entry
 * @param missCount     fresh lookups that found nothing usable
 * @param evictionCount entries evicted for size or stale retention
 * @param size          approximate number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
