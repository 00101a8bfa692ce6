package com.reference.matching.api;

import com.reference.matching.core.model.NormalizedReference;

import java.util.Optional;

/**
 * Fetches the product page of one competitor store for a reference.
 * Implementations own browser or HTTP plumbing; the engine only paces
 * their calls, validates what they return and caches the verdict.
 */
public interface StoreScraper {

    /**
     * Stable store identifier, also used as the cache file name prefix.
     */
    String storeId();

    /**
     * Searches the store for a reference.
     *
     * @param rawReference the reference as written in the feed
     * @param reference    the normalized reference
     * @return the best product page, or empty if the store returned no result
     * @throws Exception if the fetch failed (network error, blocked, timeout)
     */
    Optional<ScrapedPage> fetch(String rawReference, NormalizedReference reference) throws Exception;
}
