package com.reference.matching.validation;

/**
 * Configuration for match validation.
 *
 * @param acceptThreshold  minimum confidence for a verdict to count as found
 * @param minSegmentLength composite segments shorter than this are never matched on their own,
 *                         since one or two characters occur in almost any page text
 */
public record ValidationConfig(double acceptThreshold, int minSegmentLength) {

    public static final int DEFAULT_MIN_SEGMENT_LENGTH = 3;

    public ValidationConfig {
        if (acceptThreshold < 0.0 || acceptThreshold > 1.0) {
            throw new IllegalArgumentException("acceptThreshold must be between 0.0 and 1.0");
        }
        if (minSegmentLength < 1) {
            throw new IllegalArgumentException("minSegmentLength must be >= 1");
        }
    }

    public ValidationConfig(double acceptThreshold) {
        this(acceptThreshold, DEFAULT_MIN_SEGMENT_LENGTH);
    }

    /**
     * Default validation configuration: accept at 0.65, segments of 3 characters or more.
     */
    public static ValidationConfig defaults() {
        return new ValidationConfig(0.65, DEFAULT_MIN_SEGMENT_LENGTH);
    }
}
