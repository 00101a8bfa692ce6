package com.reference.matching.api;

import java.util.concurrent.atomic.LongAdder;

/**
 * Running lookup counters of one store.
 */
public class StoreLookupStats {

    private final String storeId;
    private final LongAdder searches = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder found = new LongAdder();
    private final LongAdder notFound = new LongAdder();
    private final LongAdder errors = new LongAdder();

    public StoreLookupStats(String storeId) {
        this.storeId = storeId;
    }

    void recordSearch() {
        searches.increment();
    }

    void recordCacheHit() {
        cacheHits.increment();
    }

    void recordCacheMiss() {
        cacheMisses.increment();
    }

    void recordVerdict(boolean valid) {
        if (valid) {
            found.increment();
        } else {
            notFound.increment();
        }
    }

    void recordError() {
        errors.increment();
    }

    public String getStoreId() {
        return storeId;
    }

    public long getSearches() {
        return searches.sum();
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public long getCacheMisses() {
        return cacheMisses.sum();
    }

    public long getFound() {
        return found.sum();
    }

    public long getNotFound() {
        return notFound.sum();
    }

    public long getErrors() {
        return errors.sum();
    }

    /**
     * Cache hits over all searches, 0 when nothing was searched.
     */
    public double getHitRate() {
        long total = getSearches();
        return total == 0 ? 0.0 : (double) getCacheHits() / total;
    }

    /**
     * Found references over all searches, 0 when nothing was searched.
     */
    public double getSuccessRate() {
        long total = getSearches();
        return total == 0 ? 0.0 : (double) getFound() / total;
    }

    @Override
    public String toString() {
        return String.format("StoreLookupStats{store=%s, searches=%d, hits=%d, misses=%d, found=%d, "
                        + "notFound=%d, errors=%d, hitRate=%.2f, successRate=%.2f}",
                storeId, getSearches(), getCacheHits(), getCacheMisses(), getFound(),
                getNotFound(), getErrors(), getHitRate(), getSuccessRate());
    }
}
