package com.reference.matching.core.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Catalog product as delivered by the feed parser.
 * Only the raw reference is normalized; the price is kept for the
 * percentage difference computed by the report.
 */
public record FeedProduct(String id, String title, String rawReference, BigDecimal priceAmount,
                          String priceCurrency) {

    public FeedProduct {
        Objects.requireNonNull(id, "id is required");
        title = title != null ? title : "";
        rawReference = rawReference != null ? rawReference : "";
        priceCurrency = priceCurrency != null ? priceCurrency : "EUR";
    }

    /**
     * Returns true if the raw reference joins several manufacturer codes.
     */
    public boolean hasCompositeReference() {
        return rawReference.contains("+");
    }
}
