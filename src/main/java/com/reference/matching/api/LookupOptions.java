package com.reference.matching.api;

/**
 * Per-run cache behavior.
 *
 * @param useCache when false the cache is neither read nor written
 * @param refresh  when true each store cache is cleared once before its first lookup
 */
public record LookupOptions(boolean useCache, boolean refresh) {

    public static LookupOptions defaults() {
        return new LookupOptions(true, false);
    }

    public static LookupOptions noCache() {
        return new LookupOptions(false, false);
    }

    public static LookupOptions refreshing() {
        return new LookupOptions(true, true);
    }
}
