package com.reference.matching.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scored outcome of comparing one reference against one candidate page.
 * Immutable: enriching a verdict with a price or URL returns a new instance.
 *
 * <p>{@code valid} is derived, never supplied: it is true iff the confidence
 * reaches the acceptance threshold and the type is not {@link MatchType#NO_MATCH}.</p>
 */
public final class MatchVerdict {

    private final boolean valid;
    private final double confidence;
    private final MatchType matchType;
    private final List<String> matchedParts;
    private final String reason;
    private final BigDecimal price;
    private final String url;

    private MatchVerdict(boolean valid, double confidence, MatchType matchType, List<String> matchedParts,
                         String reason, BigDecimal price, String url) {
        Objects.requireNonNull(matchType, "matchType is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
        if (!matchType.admits(confidence)) {
            throw new IllegalArgumentException("confidence " + confidence
                    + " is outside the band of " + matchType);
        }
        this.confidence = confidence;
        this.matchType = matchType;
        this.matchedParts = matchedParts != null ? List.copyOf(matchedParts) : List.of();
        this.reason = reason != null ? reason : "";
        this.price = price;
        this.url = url;
        this.valid = valid;
    }

    private static boolean accepted(MatchType matchType, double confidence, double acceptThreshold) {
        return confidence >= acceptThreshold && matchType != MatchType.NO_MATCH;
    }

    /**
     * Creates a verdict; validity is derived from the given acceptance threshold.
     */
    public static MatchVerdict of(MatchType matchType, double confidence, List<String> matchedParts,
                                  String reason, double acceptThreshold) {
        return new MatchVerdict(accepted(matchType, confidence, acceptThreshold),
                confidence, matchType, matchedParts, reason, null, null);
    }

    /**
     * Restores a verdict read back from persistent storage.
     */
    public static MatchVerdict restore(MatchType matchType, double confidence, List<String> matchedParts,
                                       String reason, BigDecimal price, String url, double acceptThreshold) {
        return new MatchVerdict(accepted(matchType, confidence, acceptThreshold),
                confidence, matchType, matchedParts, reason, price, url);
    }

    /**
     * Creates a no-match verdict.
     */
    public static MatchVerdict noMatch(String reason) {
        return new MatchVerdict(false, 0.0, MatchType.NO_MATCH, List.of(), reason, null, null);
    }

    /**
     * Returns a copy of this verdict carrying the scraped price and product URL.
     */
    public MatchVerdict withPrice(BigDecimal price, String url) {
        return new MatchVerdict(valid, confidence, matchType, matchedParts, reason, price, url);
    }

    public boolean isValid() {
        return valid;
    }

    public double getConfidence() {
        return confidence;
    }

    public MatchType getMatchType() {
        return matchType;
    }

    public List<String> getMatchedParts() {
        return matchedParts;
    }

    public String getReason() {
        return reason;
    }

    public Optional<BigDecimal> getPrice() {
        return Optional.ofNullable(price);
    }

    public Optional<String> getUrl() {
        return Optional.ofNullable(url);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchVerdict that = (MatchVerdict) o;
        return valid == that.valid
                && Double.compare(that.confidence, confidence) == 0
                && matchType == that.matchType
                && matchedParts.equals(that.matchedParts)
                && reason.equals(that.reason)
                && Objects.equals(price, that.price)
                && Objects.equals(url, that.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(valid, confidence, matchType, matchedParts, reason, price, url);
    }

    @Override
    public String toString() {
        return "MatchVerdict{" +
                "valid=" + valid +
                ", confidence=" + confidence +
                ", matchType=" + matchType +
                ", matchedParts=" + matchedParts +
                ", reason='" + reason + '\'' +
                ", price=" + price +
                ", url='" + url + '\'' +
                '}';
    }
}
