package com.reference.matching.cache;

import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;

import java.time.Instant;
import java.util.Optional;

/**
 * Lookup results of one store, keyed by canonical reference.
 * Entries are served only before their expiry instant.
 */
public interface ResultCache extends AutoCloseable {

    /**
     * Returns the store namespace of this cache.
     */
    String getStoreId();

    /**
     * Gets the cached entry for a reference.
     *
     * @param ref the normalized reference
     * @return the entry, or empty if absent or expired
     */
    Optional<CacheEntry> lookup(NormalizedReference ref);

    /**
     * Gets the live entry for a reference without counting a hit or a miss.
     */
    Optional<CacheEntry> peek(NormalizedReference ref);

    /**
     * Stores a verdict fetched now, replacing any prior entry.
     */
    CacheEntry store(NormalizedReference ref, MatchVerdict verdict);

    /**
     * Stores a verdict fetched at the given instant, replacing any prior entry.
     *
     * @return the entry written
     */
    CacheEntry store(NormalizedReference ref, MatchVerdict verdict, Instant fetchedAt);

    /**
     * Removes every entry whose expiry instant is at or before now.
     *
     * @return the number of entries removed
     */
    int purgeExpired();

    /**
     * Removes all entries of this store.
     */
    void invalidateAll();

    /**
     * Writes pending changes to persistent storage.
     */
    void flush();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();

    /**
     * Flushes pending changes.
     */
    @Override
    void close();
}
