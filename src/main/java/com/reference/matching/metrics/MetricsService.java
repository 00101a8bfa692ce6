package com.reference.matching.metrics;

import com.reference.matching.core.model.MatchType;
import com.reference.matching.ratelimit.PacingMode;

import java.time.Duration;

/**
 * Interface for recording engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit(String storeId);

    void recordCacheMiss(String storeId);

    void recordCacheLoadWarnings(String storeId, int count);

    void recordVerdict(String storeId, MatchType matchType);

    void recordFetchOutcome(String storeId, boolean success);

    void recordThrottleWait(Duration waited);

    void recordModeTransition(PacingMode mode);

    void recordThrottleViolation();
}
