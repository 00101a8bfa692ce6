package com.reference.matching.ratelimit;

/**
 * Configuration for the adaptive rate limiter.
 *
 * <pre>
 * reference-matching.rate-limit.min-gap-seconds=7.5
 * reference-matching.rate-limit.circuit-threshold=0.30
 * reference-matching.rate-limit.window-size=20
 * </pre>
 *
 * @param minGapSeconds     minimum time between two outbound requests in NORMAL mode
 * @param slowMultiplier    factor applied to the gap in SLOW mode
 * @param circuitThreshold  failure fraction above which SLOW mode is entered
 * @param windowSize        number of recent outcomes considered
 * @param jitterMinSeconds  lower bound of the random pause added when a caller waits
 * @param jitterMaxSeconds  upper bound of the random pause added when a caller waits
 */
public record RateLimiterConfig(
        double minGapSeconds,
        double slowMultiplier,
        double circuitThreshold,
        int windowSize,
        double jitterMinSeconds,
        double jitterMaxSeconds
) {

    public RateLimiterConfig {
        if (minGapSeconds < 0.0) {
            throw new IllegalArgumentException("minGapSeconds must be >= 0");
        }
        if (slowMultiplier < 1.0) {
            throw new IllegalArgumentException("slowMultiplier must be >= 1");
        }
        if (circuitThreshold < 0.0 || circuitThreshold > 1.0) {
            throw new IllegalArgumentException("circuitThreshold must be between 0.0 and 1.0");
        }
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be > 0");
        }
        if (jitterMinSeconds < 0.0 || jitterMaxSeconds < jitterMinSeconds) {
            throw new IllegalArgumentException("jitter range must satisfy 0 <= min <= max");
        }
    }

    /**
     * Default configuration: 7.5s gap, doubled in SLOW mode above 30% failures
     * over the last 20 requests, 0.7-1.5s jitter.
     */
    public static RateLimiterConfig defaults() {
        return new RateLimiterConfig(7.5, 2.0, 0.30, 20, 0.7, 1.5);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double minGapSeconds = 7.5;
        private double slowMultiplier = 2.0;
        private double circuitThreshold = 0.30;
        private int windowSize = 20;
        private double jitterMinSeconds = 0.7;
        private double jitterMaxSeconds = 1.5;

        public Builder minGapSeconds(double minGapSeconds) {
            this.minGapSeconds = minGapSeconds;
            return this;
        }

        public Builder slowMultiplier(double slowMultiplier) {
            this.slowMultiplier = slowMultiplier;
            return this;
        }

        public Builder circuitThreshold(double circuitThreshold) {
            this.circuitThreshold = circuitThreshold;
            return this;
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder jitter(double minSeconds, double maxSeconds) {
            this.jitterMinSeconds = minSeconds;
            this.jitterMaxSeconds = maxSeconds;
            return this;
        }

        public RateLimiterConfig build() {
            return new RateLimiterConfig(minGapSeconds, slowMultiplier, circuitThreshold,
                    windowSize, jitterMinSeconds, jitterMaxSeconds);
        }
    }
}
