package com.reference.matching.health;

import com.reference.matching.cache.StoreCacheRegistry;
import com.reference.matching.ratelimit.AdaptiveRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the engine's health checks on demand.
 */
public class EngineHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(EngineHealthMonitor.class);

    private final List<HealthCheck> checks;

    public EngineHealthMonitor(List<HealthCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    /**
     * Monitors the shared rate limiter and the store caches.
     */
    public static EngineHealthMonitor of(AdaptiveRateLimiter rateLimiter, StoreCacheRegistry cacheRegistry) {
        return new EngineHealthMonitor(List.of(
                new RateLimiterHealthCheck(rateLimiter),
                new ResultCacheHealthCheck(cacheRegistry)));
    }

    public EngineHealth check() {
        List<ComponentHealth> components = new ArrayList<>(checks.size());
        for (HealthCheck check : checks) {
            components.add(check.check());
        }
        EngineHealth health = new EngineHealth(components);
        if (health.isDegraded()) {
            log.warn("engine.health.degraded {}", health.summary());
        }
        return health;
    }
}
