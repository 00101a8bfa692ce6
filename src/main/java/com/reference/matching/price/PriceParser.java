package com.reference.matching.price;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses scraped price text into a decimal amount.
 *
 * <p>Handles both notations found on storefronts: {@code "€ 365.50"},
 * {@code "1,234.56 EUR"} and the European {@code "1.234,56 €"}. A single comma
 * placed after the last dot is read as the decimal separator.</p>
 */
public final class PriceParser {

    private static final Pattern CURRENCY = Pattern.compile("€|\\bEUR\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NOT_NUMERIC = Pattern.compile("[^\\d,.\\-]");

    private PriceParser() {
        // Utility class
    }

    /**
     * Parses the given text; returns empty when no amount can be read.
     */
    public static Optional<BigDecimal> parse(String priceText) {
        if (priceText == null || priceText.isBlank()) {
            return Optional.empty();
        }
        String s = CURRENCY.matcher(priceText).replaceAll(" ");
        s = NOT_NUMERIC.matcher(s).replaceAll("");
        if (s.isEmpty()) {
            return Optional.empty();
        }

        int comma = s.lastIndexOf(',');
        boolean decimalComma = comma >= 0 && s.indexOf(',') == comma && comma > s.lastIndexOf('.');
        if (decimalComma) {
            s = s.replace(".", "").replace(',', '.');
        } else {
            s = s.replace(",", "");
        }

        try {
            return Optional.of(new BigDecimal(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
