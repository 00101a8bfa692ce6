package com.reference.matching.ratelimit;

/**
 * Read-only snapshot of the rate limiter.
 *
 * @param minGapSeconds       configured gap in NORMAL mode
 * @param effectiveGapSeconds gap currently enforced
 * @param slowMode            whether SLOW mode is active
 * @param recentFailRate      failure fraction over the held outcomes
 * @param windowSize          number of outcomes currently held
 */
public record RateLimiterStats(
        double minGapSeconds,
        double effectiveGapSeconds,
        boolean slowMode,
        double recentFailRate,
        int windowSize
) {

    public PacingMode mode() {
        return slowMode ? PacingMode.SLOW : PacingMode.NORMAL;
    }

    @Override
    public String toString() {
        return String.format("RateLimiterStats{gap=%.1fs, slowMode=%s, failRate=%.1f%%, window=%d}",
                effectiveGapSeconds, slowMode, recentFailRate * 100, windowSize);
    }
}
