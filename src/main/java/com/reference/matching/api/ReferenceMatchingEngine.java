package com.reference.matching.api;

import com.reference.matching.cache.StoreCacheRegistry;
import com.reference.matching.config.EngineConfig;
import com.reference.matching.core.model.FeedProduct;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.core.model.PageSignals;
import com.reference.matching.health.EngineHealth;
import com.reference.matching.health.EngineHealthMonitor;
import com.reference.matching.lock.KeyedLock;
import com.reference.matching.lock.StripedKeyedLock;
import com.reference.matching.metrics.MetricsService;
import com.reference.matching.metrics.NoOpMetricsService;
import com.reference.matching.price.PriceComparison;
import com.reference.matching.ratelimit.AdaptiveRateLimiter;
import com.reference.matching.ratelimit.RateLimiterStats;
import com.reference.matching.ratelimit.Sleeper;
import com.reference.matching.rules.ReferenceNormalizer;
import com.reference.matching.validation.MatchValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Main entry point for matching feed references against competitor stores.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (ReferenceMatchingEngine engine = ReferenceMatchingEngine.builder()
 *         .config(EngineConfigLoader.load())
 *         .cacheDirectory(Path.of("cache"))
 *         .build()) {
 *
 *     LookupResult result = engine.lookup(wrsScraper, product);
 *     if (result.isFound()) {
 *         engine.comparePrice(product, result).percentDifference()
 *               .ifPresent(diff -&gt; log.info("{}%", diff));
 *     }
 * }
 * </pre>
 *
 * <p>One engine serves one run: all stores share its rate limiter, each store
 * gets its own cache file.</p>
 */
public class ReferenceMatchingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReferenceMatchingEngine.class);

    private final EngineConfig config;
    private final ReferenceNormalizer normalizer;
    private final MatchValidator validator;
    private final AdaptiveRateLimiter rateLimiter;
    private final StoreCacheRegistry cacheRegistry;
    private final ReferenceLookupService lookupService;
    private final MetricsService metricsService;
    private final EngineHealthMonitor healthMonitor;

    private ReferenceMatchingEngine(Builder builder) {
        EngineConfig engineConfig = builder.config;
        if (builder.cacheDirectory != null) {
            engineConfig = new EngineConfig(engineConfig.cache().withDirectory(builder.cacheDirectory),
                    engineConfig.rateLimit(), engineConfig.validation(), engineConfig.lock());
        }
        this.config = engineConfig;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.normalizer = new ReferenceNormalizer();
        this.validator = new MatchValidator(normalizer, config.validation());

        this.rateLimiter = new AdaptiveRateLimiter(config.rateLimit(), clock,
                builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM,
                builder.random != null ? builder.random : new SecureRandom(),
                metricsService);
        this.cacheRegistry = new StoreCacheRegistry(config.cache(), config.validation().acceptThreshold(),
                clock, metricsService);

        KeyedLock keyedLock = builder.keyedLock != null
                ? builder.keyedLock : new StripedKeyedLock(config.lock());
        this.lookupService = new ReferenceLookupService(normalizer, validator, rateLimiter, cacheRegistry,
                keyedLock, metricsService, clock);

        this.healthMonitor = EngineHealthMonitor.of(rateLimiter, cacheRegistry);

        log.info("engine.initialized cacheDir={} cacheEnabled={} minGap={}s",
                config.cache().directory(), config.cache().enabled(), config.rateLimit().minGapSeconds());
    }

    // ========== Matching API ==========

    /**
     * Normalizes a raw feed or page reference.
     */
    public NormalizedReference normalize(String rawReference) {
        return normalizer.normalize(rawReference);
    }

    /**
     * Scores a reference against the signals of a page, without fetching or caching.
     */
    public MatchVerdict score(NormalizedReference reference, PageSignals signals) {
        return validator.score(reference, signals);
    }

    public LookupResult lookup(StoreScraper scraper, FeedProduct product) {
        return lookupService.lookup(scraper, product);
    }

    public LookupResult lookup(StoreScraper scraper, FeedProduct product, LookupOptions options) {
        return lookupService.lookup(scraper, product, options);
    }

    public List<LookupResult> lookupAll(StoreScraper scraper, List<FeedProduct> products, LookupOptions options) {
        return lookupService.lookupAll(scraper, products, options);
    }

    /**
     * Compares the feed price of a product with the store price of a lookup result.
     * The store price is only taken from valid verdicts.
     */
    public PriceComparison comparePrice(FeedProduct product, LookupResult result) {
        Objects.requireNonNull(product, "product is required");
        Objects.requireNonNull(result, "result is required");
        MatchVerdict verdict = result.verdict();
        return new PriceComparison(product.priceAmount(),
                verdict.isValid() ? verdict.getPrice().orElse(null) : null);
    }

    // ========== Maintenance & observability ==========

    /**
     * Purges expired entries of all open store caches.
     */
    public int purgeExpired() {
        return cacheRegistry.purgeExpired();
    }

    public RateLimiterStats rateLimiterStats() {
        return rateLimiter.stats();
    }

    public StoreLookupStats statsFor(String storeId) {
        return lookupService.statsFor(storeId);
    }

    public Map<String, StoreLookupStats> getAllStats() {
        return lookupService.getAllStats();
    }

    /**
     * Returns the aggregate health of the rate limiter and the store caches.
     */
    public EngineHealth health() {
        return healthMonitor.check();
    }

    public EngineConfig getConfig() {
        return config;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public ReferenceLookupService getLookupService() {
        return lookupService;
    }

    public StoreCacheRegistry getCacheRegistry() {
        return cacheRegistry;
    }

    /**
     * Flushes and closes every store cache.
     */
    @Override
    public void close() {
        for (StoreLookupStats stats : lookupService.getAllStats().values()) {
            log.info("engine.store.summary {}", stats);
        }
        cacheRegistry.close();
        log.info("engine.closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EngineConfig config = EngineConfig.defaults();
        private Path cacheDirectory;
        private MetricsService metricsService;
        private KeyedLock keyedLock;
        private Clock clock;
        private Sleeper sleeper;
        private Random random;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        /**
         * Overrides the cache directory of the configuration.
         */
        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder keyedLock(KeyedLock keyedLock) {
            this.keyedLock = keyedLock;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder random(Random random) {
            this.random = random;
            return this;
        }

        public ReferenceMatchingEngine build() {
            return new ReferenceMatchingEngine(this);
        }
    }
}
