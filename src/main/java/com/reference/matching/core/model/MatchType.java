package com.reference.matching.core.model;

/**
 * Kind of evidence that tied a candidate page to a reference.
 * Each type owns a fixed confidence band; a verdict never carries a
 * confidence outside the band of its type.
 */
public enum MatchType {
    /**
     * The page's SKU attribute equals the reference.
     */
    SKU_MATCH(1.00, 1.00),

    /**
     * The reference appears in the page title or its meta codes.
     */
    EXACT_MATCH(0.95, 0.95),

    /**
     * The reference appears in the URL, or every part of a composite
     * reference appears in title, meta codes or URL.
     */
    STRONG_MATCH(0.85, 0.90),

    /**
     * Only some parts of a composite reference were found.
     * Not produced by the validator; kept so older cache files still load.
     */
    PARTIAL_MATCH(0.30, 0.60),

    /**
     * The reference only appears in body text, or parts were matched loosely.
     */
    FUZZY_MATCH(0.60, 0.75),

    /**
     * Nothing on the page ties it to the reference.
     */
    NO_MATCH(0.00, 0.00);

    private final double minConfidence;
    private final double maxConfidence;

    MatchType(double minConfidence, double maxConfidence) {
        this.minConfidence = minConfidence;
        this.maxConfidence = maxConfidence;
    }

    public double minConfidence() {
        return minConfidence;
    }

    public double maxConfidence() {
        return maxConfidence;
    }

    /**
     * Returns true if the given confidence lies within this type's band.
     */
    public boolean admits(double confidence) {
        return confidence >= minConfidence && confidence <= maxConfidence;
    }
}
