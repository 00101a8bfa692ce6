package com.reference.matching.config;

import com.reference.matching.cache.CacheConfig;
import com.reference.matching.lock.LockConfig;
import com.reference.matching.ratelimit.RateLimiterConfig;
import com.reference.matching.validation.ValidationConfig;
import org.eclipse.microprofile.config.Config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Complete configuration surface of the engine.
 *
 * <p>Externally supplied through MicroProfile Config, defaults in
 * {@code META-INF/microprofile-config.properties}:</p>
 * <pre>
 * reference-matching.cache.directory=cache
 * reference-matching.cache.ttl-found-days=10
 * reference-matching.cache.ttl-not-found-days=4
 * reference-matching.rate-limit.min-gap-seconds=7.5
 * reference-matching.rate-limit.circuit-threshold=0.30
 * reference-matching.rate-limit.window-size=20
 * reference-matching.validation.accept-threshold=0.65
 * reference-matching.validation.min-segment-length=3
 * </pre>
 *
 * @param cache      result cache configuration
 * @param rateLimit  request pacing configuration
 * @param validation match validation configuration
 * @param lock       per-reference lock configuration
 */
public record EngineConfig(
        CacheConfig cache,
        RateLimiterConfig rateLimit,
        ValidationConfig validation,
        LockConfig lock
) {

    public static final String PREFIX = "reference-matching.";

    public EngineConfig {
        Objects.requireNonNull(cache, "cache is required");
        Objects.requireNonNull(rateLimit, "rateLimit is required");
        Objects.requireNonNull(validation, "validation is required");
        Objects.requireNonNull(lock, "lock is required");
    }

    /**
     * Default configuration of every component.
     */
    public static EngineConfig defaults() {
        return new EngineConfig(CacheConfig.defaults(), RateLimiterConfig.defaults(),
                ValidationConfig.defaults(), LockConfig.defaults());
    }

    /**
     * Builds a configuration from MicroProfile Config; missing keys take their default value.
     *
     * @throws ConfigurationException if a value cannot be converted or is out of range
     */
    public static EngineConfig fromConfig(Config config) {
        CacheConfig cacheDefaults = CacheConfig.defaults();
        RateLimiterConfig rateDefaults = RateLimiterConfig.defaults();
        LockConfig lockDefaults = LockConfig.defaults();
        try {
            CacheConfig cache = new CacheConfig(
                    Path.of(value(config, "cache.directory", String.class,
                            cacheDefaults.directory().toString())),
                    Duration.ofDays(value(config, "cache.ttl-found-days", Integer.class,
                            (int) cacheDefaults.ttlFound().toDays())),
                    Duration.ofDays(value(config, "cache.ttl-not-found-days", Integer.class,
                            (int) cacheDefaults.ttlNotFound().toDays())),
                    value(config, "cache.max-size", Integer.class, cacheDefaults.maxSize()),
                    value(config, "cache.flush-batch-size", Integer.class, cacheDefaults.flushBatchSize()),
                    value(config, "cache.enabled", Boolean.class, cacheDefaults.enabled()));

            RateLimiterConfig rateLimit = new RateLimiterConfig(
                    value(config, "rate-limit.min-gap-seconds", Double.class, rateDefaults.minGapSeconds()),
                    value(config, "rate-limit.slow-multiplier", Double.class, rateDefaults.slowMultiplier()),
                    value(config, "rate-limit.circuit-threshold", Double.class, rateDefaults.circuitThreshold()),
                    value(config, "rate-limit.window-size", Integer.class, rateDefaults.windowSize()),
                    value(config, "rate-limit.jitter-min-seconds", Double.class, rateDefaults.jitterMinSeconds()),
                    value(config, "rate-limit.jitter-max-seconds", Double.class, rateDefaults.jitterMaxSeconds()));

            ValidationConfig validationDefaults = ValidationConfig.defaults();
            ValidationConfig validation = new ValidationConfig(
                    value(config, "validation.accept-threshold", Double.class,
                            validationDefaults.acceptThreshold()),
                    value(config, "validation.min-segment-length", Integer.class,
                            validationDefaults.minSegmentLength()));

            LockConfig lock = new LockConfig(
                    value(config, "lock.timeout-ms", Long.class, lockDefaults.timeoutMs()),
                    value(config, "lock.stripes", Integer.class, lockDefaults.stripes()));

            return new EngineConfig(cache, rateLimit, validation, lock);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid engine configuration: " + e.getMessage(), e);
        }
    }

    private static <T> T value(Config config, String key, Class<T> type, T defaultValue) {
        String name = PREFIX + key;
        try {
            return config.getOptionalValue(name, type).orElse(defaultValue);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Property " + name + " has an invalid value: " + e.getMessage(), e);
        }
    }
}
