package com.reference.matching.price;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Difference between a store's price and the catalog price, as shown in the report.
 * The relative difference is {@code (storePrice - feedPrice) / feedPrice}: positive
 * when the store is more expensive.
 *
 * @param feedPrice  the merchant's catalog price, may be null
 * @param storePrice the competitor's price, may be null
 */
public record PriceComparison(BigDecimal feedPrice, BigDecimal storePrice) {

    private static final int SCALE = 4;

    /**
     * Returns the relative difference as a fraction (0.2000 for +20%), or empty when
     * either price is missing or the catalog price is zero.
     */
    public Optional<BigDecimal> relativeDifference() {
        if (feedPrice == null || storePrice == null || feedPrice.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(storePrice.subtract(feedPrice).divide(feedPrice, SCALE, RoundingMode.HALF_UP));
    }

    /**
     * Returns the relative difference in percent (20.00 for +20%).
     */
    public Optional<BigDecimal> percentDifference() {
        return relativeDifference().map(fraction -> fraction.movePointRight(2).setScale(2, RoundingMode.HALF_UP));
    }
}
