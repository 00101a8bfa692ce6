package com.reference.matching.metrics;

import com.reference.matching.core.model.MatchType;
import com.reference.matching.ratelimit.PacingMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reference.cache.hit} / {@code reference.cache.miss} - Counter (tag: store)</li>
 *   <li>{@code reference.cache.load.warnings} - Counter (tag: store)</li>
 *   <li>{@code reference.verdict} - Counter (tags: store, matchType)</li>
 *   <li>{@code reference.fetch} - Counter (tags: store, outcome)</li>
 *   <li>{@code reference.throttle.wait} - Timer</li>
 *   <li>{@code reference.throttle.mode} - Counter (tag: mode)</li>
 *   <li>{@code reference.throttle.violation} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer throttleWaitTimer;
    private final Counter throttleViolationCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.throttleWaitTimer = Timer.builder("reference.throttle.wait")
                .description("Time callers spent suspended in the request gate")
                .register(registry);
        this.throttleViolationCounter = Counter.builder("reference.throttle.violation")
                .description("Outcomes recorded without a preceding acquire")
                .register(registry);
    }

    @Override
    public void recordCacheHit(String storeId) {
        counter("reference.cache.hit", "Number of result cache hits", "store", storeId).increment();
    }

    @Override
    public void recordCacheMiss(String storeId) {
        counter("reference.cache.miss", "Number of result cache misses", "store", storeId).increment();
    }

    @Override
    public void recordCacheLoadWarnings(String storeId, int count) {
        if (count > 0) {
            counter("reference.cache.load.warnings", "Cache entries dropped while loading",
                    "store", storeId).increment(count);
        }
    }

    @Override
    public void recordVerdict(String storeId, MatchType matchType) {
        String key = "verdict:" + storeId + ":" + matchType.name();
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("reference.verdict")
                        .description("Verdicts produced by the match validator")
                        .tag("store", storeId)
                        .tag("matchType", matchType.name())
                        .register(registry))
                .increment();
    }

    @Override
    public void recordFetchOutcome(String storeId, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = "fetch:" + storeId + ":" + outcome;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("reference.fetch")
                        .description("Outbound store fetches by outcome")
                        .tag("store", storeId)
                        .tag("outcome", outcome)
                        .register(registry))
                .increment();
    }

    @Override
    public void recordThrottleWait(Duration waited) {
        throttleWaitTimer.record(waited);
    }

    @Override
    public void recordModeTransition(PacingMode mode) {
        counter("reference.throttle.mode", "Pacing mode transitions", "mode", mode.name()).increment();
    }

    @Override
    public void recordThrottleViolation() {
        throttleViolationCounter.increment();
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        String key = name + ":" + tagValue;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
