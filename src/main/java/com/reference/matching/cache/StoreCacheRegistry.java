package com.reference.matching.cache;

import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.metrics.MetricsService;
import com.reference.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One {@link ResultCache} per store for a single run.
 * Caches are opened lazily on first use; each store has its own file, so
 * storage problems in one store never affect another.
 */
public class StoreCacheRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreCacheRegistry.class);

    private final CacheConfig config;
    private final double acceptThreshold;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ConcurrentMap<String, ResultCache> caches = new ConcurrentHashMap<>();

    public StoreCacheRegistry(CacheConfig config, double acceptThreshold) {
        this(config, acceptThreshold, Clock.systemUTC(), new NoOpMetricsService());
    }

    public StoreCacheRegistry(CacheConfig config, double acceptThreshold, Clock clock,
                              MetricsService metricsService) {
        this.config = config;
        this.acceptThreshold = acceptThreshold;
        this.clock = clock;
        this.metricsService = metricsService;
    }

    /**
     * Returns the cache of the given store, opening and loading it on first use.
     */
    public ResultCache forStore(String storeId) {
        return caches.computeIfAbsent(storeId, this::open);
    }

    private ResultCache open(String storeId) {
        if (!config.enabled()) {
            return new NoOpResultCache(storeId);
        }
        CacheFileStore fileStore = new CacheFileStore(config.directory(), storeId, acceptThreshold);
        return new CaffeineResultCache(storeId, config, fileStore, clock, metricsService);
    }

    /**
     * Gets the live entry for a reference in a store.
     */
    public Optional<CacheEntry> lookup(String storeId, NormalizedReference ref) {
        return forStore(storeId).lookup(ref);
    }

    /**
     * Stores a verdict for a reference in a store, replacing any prior entry.
     */
    public CacheEntry store(String storeId, NormalizedReference ref, MatchVerdict verdict, Instant now) {
        return forStore(storeId).store(ref, verdict, now);
    }

    /**
     * Purges expired entries of every open store.
     *
     * @return the total number of entries removed
     */
    public int purgeExpired() {
        int removed = 0;
        for (ResultCache cache : caches.values()) {
            removed += cache.purgeExpired();
        }
        return removed;
    }

    /**
     * Returns the caches opened so far.
     */
    public Collection<ResultCache> openCaches() {
        return List.copyOf(caches.values());
    }

    public CacheConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        for (ResultCache cache : caches.values()) {
            cache.close();
        }
        log.debug("cache.registry.closed stores={}", caches.size());
    }
}
