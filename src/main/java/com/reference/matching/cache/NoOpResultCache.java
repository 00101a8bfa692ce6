package com.reference.matching.cache;

import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * No-op cache implementation. Nothing is kept; every lookup misses.
 * Used when caching is disabled.
 */
public class NoOpResultCache implements ResultCache {

    private final String storeId;

    public NoOpResultCache(String storeId) {
        this.storeId = storeId;
    }

    @Override
    public String getStoreId() {
        return storeId;
    }

    @Override
    public Optional<CacheEntry> lookup(NormalizedReference ref) {
        return Optional.empty();
    }

    @Override
    public Optional<CacheEntry> peek(NormalizedReference ref) {
        return Optional.empty();
    }

    @Override
    public CacheEntry store(NormalizedReference ref, MatchVerdict verdict) {
        return store(ref, verdict, Instant.now());
    }

    @Override
    public CacheEntry store(NormalizedReference ref, MatchVerdict verdict, Instant fetchedAt) {
        return CacheEntry.create(storeId, ref.canonical(), verdict, fetchedAt, Duration.ZERO, Duration.ZERO);
    }

    @Override
    public int purgeExpired() {
        return 0;
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public void flush() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }

    @Override
    public void close() {
        // no-op
    }
}
