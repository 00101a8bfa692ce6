package com.reference.matching.cache;

/**
 * Result cache metrics for one store.
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that found nothing servable
 * @param size          entries currently held, expired or not
 * @param foundCount    live entries whose verdict found the product
 * @param notFoundCount live entries whose verdict rejected every candidate
 * @param expiredCount  entries held but no longer served
 * @param loadWarnings  entries dropped as unreadable when the cache was loaded
 */
public record CacheStats(long hitCount, long missCount, long size, long foundCount, long notFoundCount,
                         long expiredCount, int loadWarnings) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0, 0, 0, 0);
    }
}
