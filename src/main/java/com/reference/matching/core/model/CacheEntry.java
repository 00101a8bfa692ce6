package com.reference.matching.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Cached lookup outcome for one reference in one store.
 * Owned by the result cache; replaced wholesale on every fresh fetch.
 *
 * @param key       canonical reference
 * @param storeId   store namespace
 * @param verdict   verdict of the last fetch
 * @param fetchedAt when the verdict was produced
 * @param expiresAt first instant at which the entry is no longer served
 */
public record CacheEntry(String key, String storeId, MatchVerdict verdict, Instant fetchedAt, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(storeId, "storeId is required");
        Objects.requireNonNull(verdict, "verdict is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(expiresAt, "expiresAt is required");
        if (expiresAt.isBefore(fetchedAt)) {
            throw new IllegalArgumentException("expiresAt must not precede fetchedAt");
        }
    }

    /**
     * Creates an entry whose expiry depends on whether the verdict was accepted.
     */
    public static CacheEntry create(String storeId, String key, MatchVerdict verdict, Instant fetchedAt,
                                    Duration ttlFound, Duration ttlNotFound) {
        Duration ttl = verdict.isValid() ? ttlFound : ttlNotFound;
        return new CacheEntry(key, storeId, verdict, fetchedAt, fetchedAt.plus(ttl));
    }

    /**
     * Returns true if the entry must no longer be served at {@code now}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * Returns true if the cached verdict found the product.
     */
    public boolean isFound() {
        return verdict.isValid();
    }
}
