package com.reference.matching.ratelimit;

/**
 * Pacing state of the adaptive rate limiter.
 */
public enum PacingMode {
    /**
     * Failure rate at or below the circuit threshold; the base gap applies.
     */
    NORMAL,

    /**
     * Failure rate above the circuit threshold; the gap is multiplied.
     */
    SLOW
}
