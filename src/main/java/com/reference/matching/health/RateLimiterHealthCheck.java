package com.reference.matching.health;

import com.reference.matching.ratelimit.AdaptiveRateLimiter;
import com.reference.matching.ratelimit.RateLimiterStats;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reports DEGRADED while the rate limiter is in slow mode, i.e. while
 * stores are failing or throttling more than the circuit threshold allows.
 */
public class RateLimiterHealthCheck implements HealthCheck {

    static final String NAME = "rateLimiter";

    private final AdaptiveRateLimiter rateLimiter;

    public RateLimiterHealthCheck(AdaptiveRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    @Override
    public ComponentHealth check() {
        RateLimiterStats stats = rateLimiter.stats();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("mode", stats.mode().name());
        details.put("effectiveGapSeconds", stats.effectiveGapSeconds());
        details.put("recentFailRate", stats.recentFailRate());
        details.put("windowSize", stats.windowSize());
        details.put("throttleViolations", rateLimiter.throttleViolations());
        if (stats.slowMode()) {
            return ComponentHealth.degraded(NAME, String.format(Locale.ROOT,
                    "Slow mode: %.1f%% recent failures", stats.recentFailRate() * 100), details);
        }
        return ComponentHealth.operational(NAME, "Normal pacing", details);
    }
}
