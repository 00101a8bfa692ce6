package com.reference.matching.api;

import com.reference.matching.cache.ResultCache;
import com.reference.matching.cache.StoreCacheRegistry;
import com.reference.matching.core.model.CacheEntry;
import com.reference.matching.core.model.FeedProduct;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.lock.KeyedLock;
import com.reference.matching.lock.LockAcquisitionException;
import com.reference.matching.logging.LogContext;
import com.reference.matching.metrics.MetricsService;
import com.reference.matching.ratelimit.AdaptiveRateLimiter;
import com.reference.matching.rules.ReferenceNormalizer;
import com.reference.matching.validation.MatchValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Looks up feed references in competitor stores.
 *
 * <p>Per reference and store: consult the cache; on a miss wait for the rate
 * limiter, fetch through the {@link StoreScraper}, report the outcome back to
 * the limiter, score the page and cache the verdict. A failed fetch never
 * fails the run: it yields an uncached NO_MATCH verdict and is counted as an
 * error.</p>
 *
 * <p>At most one fetch per {@code (store, canonical reference)} is in flight;
 * concurrent callers for the same key wait and then read the cached verdict.</p>
 */
public class ReferenceLookupService {
    private static final Logger log = LoggerFactory.getLogger(ReferenceLookupService.class);

    private final ReferenceNormalizer normalizer;
    private final MatchValidator validator;
    private final AdaptiveRateLimiter rateLimiter;
    private final StoreCacheRegistry cacheRegistry;
    private final KeyedLock keyedLock;
    private final MetricsService metricsService;
    private final Clock clock;

    private final ConcurrentMap<String, StoreLookupStats> stats = new ConcurrentHashMap<>();
    private final Set<String> refreshedStores = ConcurrentHashMap.newKeySet();

    public ReferenceLookupService(ReferenceNormalizer normalizer, MatchValidator validator,
                                  AdaptiveRateLimiter rateLimiter, StoreCacheRegistry cacheRegistry,
                                  KeyedLock keyedLock, MetricsService metricsService, Clock clock) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.rateLimiter = rateLimiter;
        this.cacheRegistry = cacheRegistry;
        this.keyedLock = keyedLock;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Looks up a feed product in a store with default options.
     */
    public LookupResult lookup(StoreScraper scraper, FeedProduct product) {
        return lookup(scraper, product.rawReference(), LookupOptions.defaults());
    }

    /**
     * Looks up a feed product in a store.
     */
    public LookupResult lookup(StoreScraper scraper, FeedProduct product, LookupOptions options) {
        return lookup(scraper, product.rawReference(), options);
    }

    /**
     * Looks up a raw reference in a store.
     */
    public LookupResult lookup(StoreScraper scraper, String rawReference, LookupOptions options) {
        String storeId = scraper.storeId();
        NormalizedReference ref = normalizer.normalize(rawReference);
        StoreLookupStats storeStats = statsFor(storeId);
        storeStats.recordSearch();

        try (LogContext ignored = LogContext.forLookup(storeId, ref.canonical())) {
            if (!ref.isSearchable()) {
                log.debug("lookup.skipped reason=empty-reference raw='{}'", rawReference);
                storeStats.recordVerdict(false);
                return new LookupResult(storeId, ref, MatchVerdict.noMatch("Reference is empty"), false);
            }

            ResultCache cache = options.useCache() ? openCache(storeId, options) : null;
            if (cache != null) {
                Optional<LookupResult> cached = fromCache(cache, storeId, ref, storeStats);
                if (cached.isPresent()) {
                    return cached.get();
                }
            }

            String key = KeyedLock.keyOf(storeId, ref.canonical());
            try {
                keyedLock.tryLock(key);
            } catch (LockAcquisitionException e) {
                log.warn("lookup.lock.failed key={} error={}", key, e.getMessage());
                storeStats.recordError();
                return new LookupResult(storeId, ref, MatchVerdict.noMatch("Lookup lock unavailable"), false);
            }
            try {
                if (cache != null) {
                    // Another caller may have fetched this key while we waited; the miss is already counted.
                    Optional<CacheEntry> fetchedMeanwhile = cache.peek(ref);
                    if (fetchedMeanwhile.isPresent()) {
                        return cachedResult(storeId, ref, fetchedMeanwhile.get(), storeStats);
                    }
                    storeStats.recordCacheMiss();
                }
                return fetchAndScore(scraper, rawReference, ref, cache, storeStats);
            } finally {
                keyedLock.unlock(key);
            }
        }
    }

    /**
     * Looks up every product of a feed in a store, in feed order.
     */
    public List<LookupResult> lookupAll(StoreScraper scraper, List<FeedProduct> products, LookupOptions options) {
        List<LookupResult> results = new ArrayList<>(products.size());
        try (LogContext ignored = LogContext.forRun(LogContext.generateRunId())) {
            for (FeedProduct product : products) {
                results.add(lookup(scraper, product, options));
            }
            StoreLookupStats storeStats = statsFor(scraper.storeId());
            log.info("lookup.batch.completed store={} products={} found={} errors={} hitRate={}",
                    scraper.storeId(), products.size(), storeStats.getFound(), storeStats.getErrors(),
                    String.format("%.2f", storeStats.getHitRate()));
        }
        return results;
    }

    private ResultCache openCache(String storeId, LookupOptions options) {
        ResultCache cache = cacheRegistry.forStore(storeId);
        if (options.refresh() && refreshedStores.add(storeId)) {
            cache.invalidateAll();
            log.info("cache.refreshed store={}", storeId);
        }
        return cache;
    }

    private Optional<LookupResult> fromCache(ResultCache cache, String storeId, NormalizedReference ref,
                                             StoreLookupStats storeStats) {
        return cache.lookup(ref).map(entry -> cachedResult(storeId, ref, entry, storeStats));
    }

    private LookupResult cachedResult(String storeId, NormalizedReference ref, CacheEntry entry,
                                      StoreLookupStats storeStats) {
        MatchVerdict verdict = entry.verdict();
        storeStats.recordCacheHit();
        storeStats.recordVerdict(verdict.isValid());
        log.debug("lookup.cache.hit matchType={} valid={} expiresAt={}",
                verdict.getMatchType(), verdict.isValid(), entry.expiresAt());
        return new LookupResult(storeId, ref, verdict, true);
    }

    private LookupResult fetchAndScore(StoreScraper scraper, String rawReference, NormalizedReference ref,
                                       ResultCache cache, StoreLookupStats storeStats) {
        String storeId = scraper.storeId();
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("lookup.interrupted stage=throttle");
            storeStats.recordError();
            return new LookupResult(storeId, ref, MatchVerdict.noMatch("Interrupted before fetch"), false);
        }

        Optional<ScrapedPage> page;
        try {
            page = scraper.fetch(rawReference, ref);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fetchFailed(storeId, ref, storeStats, e);
        } catch (Exception e) {
            return fetchFailed(storeId, ref, storeStats, e);
        }
        rateLimiter.record(true);
        metricsService.recordFetchOutcome(storeId, true);

        MatchVerdict verdict = page
                .map(p -> score(ref, p))
                .orElseGet(() -> MatchVerdict.noMatch("No search results"));

        if (cache != null) {
            cache.store(ref, verdict, clock.instant());
        }
        metricsService.recordVerdict(storeId, verdict.getMatchType());
        storeStats.recordVerdict(verdict.isValid());
        log.info("lookup.completed matchType={} confidence={} valid={} reason='{}'",
                verdict.getMatchType(), verdict.getConfidence(), verdict.isValid(), verdict.getReason());
        return new LookupResult(storeId, ref, verdict, false);
    }

    private MatchVerdict score(NormalizedReference ref, ScrapedPage page) {
        MatchVerdict verdict = validator.score(ref, page.signals());
        if (!verdict.isValid()) {
            return verdict;
        }
        return verdict.withPrice(page.resolvedPrice().orElse(null), page.url());
    }

    private LookupResult fetchFailed(String storeId, NormalizedReference ref, StoreLookupStats storeStats,
                                     Exception e) {
        rateLimiter.record(false);
        metricsService.recordFetchOutcome(storeId, false);
        storeStats.recordError();
        log.warn("lookup.fetch.failed error={}", e.toString());
        return new LookupResult(storeId, ref, MatchVerdict.noMatch("Fetch failed: " + e.getMessage()), false);
    }

    /**
     * Returns the counters of one store, creating them on first use.
     */
    public StoreLookupStats statsFor(String storeId) {
        return stats.computeIfAbsent(storeId, StoreLookupStats::new);
    }

    /**
     * Returns the counters of every store looked up so far, ordered by store id.
     */
    public Map<String, StoreLookupStats> getAllStats() {
        return Collections.unmodifiableMap(new TreeMap<>(stats));
    }
}
