package com.reference.matching.api;

import com.reference.matching.core.model.PageSignals;
import com.reference.matching.price.PriceParser;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * A product page returned by a {@link StoreScraper}.
 * The price may be given already parsed or as the raw text shown on the page.
 */
public record ScrapedPage(PageSignals signals, String priceText, BigDecimal price, String url) {

    public ScrapedPage {
        Objects.requireNonNull(signals, "signals is required");
        if (url == null) {
            url = signals.url();
        }
    }

    public static ScrapedPage of(PageSignals signals, String priceText) {
        return new ScrapedPage(signals, priceText, null, signals.url());
    }

    /**
     * Returns the parsed price, falling back to the price text.
     */
    public Optional<BigDecimal> resolvedPrice() {
        if (price != null) {
            return Optional.of(price);
        }
        return PriceParser.parse(priceText);
    }
}
