package com.reference.matching.metrics;

import com.reference.matching.core.model.MatchType;
import com.reference.matching.ratelimit.PacingMode;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(String storeId) {
    }

    @Override
    public void recordCacheMiss(String storeId) {
    }

    @Override
    public void recordCacheLoadWarnings(String storeId, int count) {
    }

    @Override
    public void recordVerdict(String storeId, MatchType matchType) {
    }

    @Override
    public void recordFetchOutcome(String storeId, boolean success) {
    }

    @Override
    public void recordThrottleWait(Duration waited) {
    }

    @Override
    public void recordModeTransition(PacingMode mode) {
    }

    @Override
    public void recordThrottleViolation() {
    }
}
