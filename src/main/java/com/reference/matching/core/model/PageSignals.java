package com.reference.matching.core.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Signals a store scraper extracted from one candidate product page.
 * Missing fields are tolerated: nulls become empty strings or an empty set,
 * so scoring never fails on an incomplete page.
 *
 * @param sku       the page's SKU attribute, or null when the page has none
 * @param title     product title text
 * @param url       product page URL
 * @param metaCodes manufacturer/product codes found in page metadata
 * @param bodyText  visible page text
 */
public record PageSignals(String sku, String title, String url, Set<String> metaCodes, String bodyText) {

    public PageSignals {
        sku = sku == null || sku.isBlank() ? null : sku;
        title = title != null ? title : "";
        url = url != null ? url : "";
        metaCodes = cleanCodes(metaCodes != null ? metaCodes.stream() : Stream.empty());
        bodyText = bodyText != null ? bodyText : "";
    }

    // scrapers hand over whatever the page held: nulls, blanks and repeats are dropped
    private static Set<String> cleanCodes(Stream<String> codes) {
        return codes
                .filter(code -> code != null && !code.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public Optional<String> skuValue() {
        return Optional.ofNullable(sku);
    }

    /**
     * Returns empty signals, as produced for a page that could not be read.
     */
    public static PageSignals empty() {
        return new PageSignals(null, "", "", Set.of(), "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sku;
        private String title;
        private String url;
        private Set<String> metaCodes;
        private String bodyText;

        public Builder sku(String sku) {
            this.sku = sku;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder metaCodes(Set<String> metaCodes) {
            this.metaCodes = metaCodes;
            return this;
        }

        public Builder metaCodes(String... metaCodes) {
            this.metaCodes = metaCodes != null ? cleanCodes(Arrays.stream(metaCodes)) : null;
            return this;
        }

        public Builder bodyText(String bodyText) {
            this.bodyText = bodyText;
            return this;
        }

        public PageSignals build() {
            return new PageSignals(sku, title, url, metaCodes, bodyText);
        }
    }
}
