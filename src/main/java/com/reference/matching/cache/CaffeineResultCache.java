package com.reference.matching.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.metrics.MetricsService;
import com.reference.matching.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Caffeine-backed result cache for one store, persisted through a {@link CacheFileStore}.
 *
 * <p>Every live entry is held in an unbounded map that mirrors the cache file; a
 * Caffeine cache bounded by {@link CacheConfig#maxSize()} serves repeated reads and
 * loads from that map on a miss. Size eviction therefore only drops the read copy,
 * never a persisted result.</p>
 *
 * <p>Entries are immutable and replaced with a single {@code put}, so a concurrent
 * reader sees either the old or the new entry. Expiry is evaluated against each
 * entry's own {@code expiresAt}: expired entries are never served and are removed
 * by {@link #purgeExpired()}, which also runs when the cache is loaded.</p>
 *
 * <p>Storage failures are logged and swallowed into "no cached result": a broken
 * cache file costs re-fetches, never a failed run.</p>
 */
public class CaffeineResultCache implements ResultCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineResultCache.class);
    private static final Pattern STORE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_-]*");

    private final String storeId;
    private final CacheConfig config;
    private final CacheFileStore fileStore;
    private final Clock clock;
    private final MetricsService metricsService;
    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Cache<String, CacheEntry> hot;
    private final Object flushLock = new Object();
    private final AtomicInteger pendingWrites = new AtomicInteger();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final int loadWarnings;

    public CaffeineResultCache(String storeId, CacheConfig config, double acceptThreshold) {
        this(storeId, config, new CacheFileStore(config.directory(), storeId, acceptThreshold),
                Clock.systemUTC(), new NoOpMetricsService());
    }

    public CaffeineResultCache(String storeId, CacheConfig config, CacheFileStore fileStore, Clock clock,
                               MetricsService metricsService) {
        if (storeId == null || !STORE_ID.matcher(storeId).matches()) {
            throw new IllegalArgumentException("storeId must be alphanumeric with '-' or '_': " + storeId);
        }
        this.storeId = storeId;
        this.config = config;
        this.fileStore = fileStore;
        this.clock = clock;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.hot = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .executor(Runnable::run)
                .build();
        this.loadWarnings = load();
    }

    private int load() {
        CacheFileStore.LoadResult result;
        try {
            result = fileStore.load();
        } catch (CacheStorageException e) {
            log.warn("cache.load.failed store={} error={}", storeId, e.getMessage());
            metricsService.recordCacheLoadWarnings(storeId, 1);
            return 1;
        }

        entries.putAll(result.entries());
        int purged = purgeExpired();
        metricsService.recordCacheLoadWarnings(storeId, result.warnings());
        if (result.warnings() > 0) {
            log.warn("cache.loaded store={} entries={} dropped={} purged={}",
                    storeId, entries.size(), result.warnings(), purged);
        } else {
            log.info("cache.loaded store={} entries={} purged={}", storeId, entries.size(), purged);
        }
        if (result.warnings() > 0) {
            // rewrite without the unreadable entries
            pendingWrites.incrementAndGet();
        }
        if (purged > 0 || result.warnings() > 0) {
            flush();
        }
        return result.warnings();
    }

    @Override
    public String getStoreId() {
        return storeId;
    }

    @Override
    public Optional<CacheEntry> lookup(NormalizedReference ref) {
        Optional<CacheEntry> entry = peek(ref);
        if (entry.isEmpty()) {
            misses.increment();
            metricsService.recordCacheMiss(storeId);
        } else {
            hits.increment();
            metricsService.recordCacheHit(storeId);
        }
        return entry;
    }

    @Override
    public Optional<CacheEntry> peek(NormalizedReference ref) {
        if (!ref.isSearchable()) {
            return Optional.empty();
        }
        CacheEntry entry = hot.get(ref.canonical(), entries::get);
        if (entry == null || entry.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public CacheEntry store(NormalizedReference ref, MatchVerdict verdict) {
        return store(ref, verdict, clock.instant());
    }

    @Override
    public CacheEntry store(NormalizedReference ref, MatchVerdict verdict, Instant fetchedAt) {
        // persisted with second precision; truncate now so reloads see the same expiry
        Instant fetched = fetchedAt.truncatedTo(ChronoUnit.SECONDS);
        CacheEntry entry = CacheEntry.create(storeId, ref.canonical(), verdict, fetched,
                config.ttlFound(), config.ttlNotFound());
        if (!ref.isSearchable()) {
            log.debug("cache.store.skipped store={} reason=empty reference", storeId);
            return entry;
        }
        entries.put(entry.key(), entry);
        hot.put(entry.key(), entry);
        if (pendingWrites.incrementAndGet() >= config.flushBatchSize()) {
            flush();
        }
        return entry;
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now)) {
                expired.add(key);
            }
        });
        int removed = 0;
        for (String key : expired) {
            // a concurrent store may have refreshed the key since the scan
            if (entries.computeIfPresent(key, (k, entry) -> entry.isExpired(now) ? null : entry) == null) {
                hot.invalidate(key);
                removed++;
            }
        }
        if (removed > 0) {
            pendingWrites.incrementAndGet();
            log.debug("cache.purged store={} removed={}", storeId, removed);
        }
        return removed;
    }

    @Override
    public void invalidateAll() {
        entries.clear();
        hot.invalidateAll();
        pendingWrites.incrementAndGet();
        log.info("cache.invalidated store={}", storeId);
        flush();
    }

    @Override
    public void flush() {
        synchronized (flushLock) {
            int pending = pendingWrites.get();
            if (pending == 0) {
                return;
            }
            try {
                fileStore.write(new ArrayList<>(entries.values()));
                pendingWrites.addAndGet(-pending);
                log.debug("cache.flushed store={} entries={}", storeId, entries.size());
            } catch (CacheStorageException e) {
                log.error("cache.flush.failed store={} error={}", storeId, e.getMessage());
            }
        }
    }

    @Override
    public CacheStats getStats() {
        Instant now = clock.instant();
        long found = 0;
        long notFound = 0;
        long expired = 0;
        for (CacheEntry entry : entries.values()) {
            if (entry.isExpired(now)) {
                expired++;
            } else if (entry.isFound()) {
                found++;
            } else {
                notFound++;
            }
        }
        return new CacheStats(hits.sum(), misses.sum(), found + notFound + expired,
                found, notFound, expired, loadWarnings);
    }

    /**
     * Returns the number of entries dropped as unreadable when this cache was loaded.
     */
    public int getLoadWarnings() {
        return loadWarnings;
    }

    @Override
    public void close() {
        flush();
    }
}
