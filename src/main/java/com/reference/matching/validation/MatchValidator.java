package com.reference.matching.validation;

import com.reference.matching.core.model.MatchType;
import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;
import com.reference.matching.core.model.PageSignals;
import com.reference.matching.rules.ReferenceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how confidently a scraped page corresponds to a queried reference.
 *
 * <p>Rules are evaluated in strict priority order and the first one that holds wins,
 * so a weak textual hit never masks a SKU match:</p>
 * <ol>
 *   <li>SKU equals the reference: {@link MatchType#SKU_MATCH}, 1.00</li>
 *   <li>reference in a meta code or the title: {@link MatchType#EXACT_MATCH}, 0.95</li>
 *   <li>reference in the URL: {@link MatchType#STRONG_MATCH}, 0.90</li>
 *   <li>every segment of a composite reference in title, meta codes or URL:
 *       {@link MatchType#STRONG_MATCH}, 0.85</li>
 *   <li>reference in body text, or some segments anywhere on the page:
 *       {@link MatchType#FUZZY_MATCH}, 0.60 to 0.75 by the fraction of
 *       {@link NormalizedReference#parts()} matched</li>
 *   <li>otherwise {@link MatchType#NO_MATCH}, 0.00</li>
 * </ol>
 *
 * <p>The fraction counts the full canonical form as one of the parts, so one of
 * two segments scores 1/3 and a body-text hit on the canonical form scores 1/1.
 * Segments shorter than {@link ValidationConfig#minSegmentLength()} never count
 * as found, so a composite holding one never reaches the all-parts rule.</p>
 *
 * <p>Scoring is pure: no I/O, no shared state.</p>
 */
public class MatchValidator {
    private static final Logger log = LoggerFactory.getLogger(MatchValidator.class);

    static final double EXACT_CONFIDENCE = 0.95;
    static final double URL_CONFIDENCE = 0.90;
    static final double ALL_PARTS_CONFIDENCE = 0.85;

    private final ReferenceNormalizer normalizer;
    private final ValidationConfig config;

    public MatchValidator() {
        this(new ReferenceNormalizer(), ValidationConfig.defaults());
    }

    public MatchValidator(ReferenceNormalizer normalizer, ValidationConfig config) {
        this.normalizer = normalizer;
        this.config = config;
    }

    /**
     * Scores a page against a reference. Never throws for incomplete signals.
     */
    public MatchVerdict score(NormalizedReference ref, PageSignals signals) {
        if (ref == null || !ref.isSearchable()) {
            return MatchVerdict.noMatch("Reference is empty");
        }
        PageSignals page = signals != null ? signals : PageSignals.empty();
        String canonical = ref.canonical();

        String sku = page.skuValue().map(normalizer::canonicalize).orElse("");
        if (!sku.isEmpty() && sku.equals(canonical)) {
            return verdict(MatchType.SKU_MATCH, 1.0, List.of(canonical), "SKU equals reference " + canonical);
        }

        String title = normalizer.canonicalize(page.title());
        List<String> metaCodes = page.metaCodes().stream()
                .map(normalizer::canonicalize)
                .filter(code -> !code.isEmpty())
                .toList();
        if (metaCodes.stream().anyMatch(code -> code.contains(canonical))) {
            return verdict(MatchType.EXACT_MATCH, EXACT_CONFIDENCE, List.of(canonical),
                    "Reference found in page codes");
        }
        if (title.contains(canonical)) {
            return verdict(MatchType.EXACT_MATCH, EXACT_CONFIDENCE, List.of(canonical),
                    "Reference found in title");
        }

        String url = normalizer.canonicalize(page.url());
        if (url.contains(canonical)) {
            return verdict(MatchType.STRONG_MATCH, URL_CONFIDENCE, List.of(canonical), "Reference found in URL");
        }

        List<String> segments = ref.segments();
        if (ref.isComposite()) {
            List<String> structured = new ArrayList<>();
            for (String segment : segments) {
                if (!isMatchable(segment)) {
                    continue;
                }
                if (title.contains(segment) || url.contains(segment)
                        || metaCodes.stream().anyMatch(code -> code.contains(segment))) {
                    structured.add(segment);
                }
            }
            if (structured.size() == segments.size()) {
                return verdict(MatchType.STRONG_MATCH, ALL_PARTS_CONFIDENCE, structured,
                        "All " + segments.size() + " composite parts found");
            }
        }

        String body = normalizer.canonicalize(page.bodyText());
        if (body.contains(canonical)) {
            return verdict(MatchType.FUZZY_MATCH, fuzzyConfidence(1, 1), List.of(canonical),
                    "Reference found in body text only");
        }

        if (ref.isComposite()) {
            List<String> loose = new ArrayList<>();
            for (String segment : segments) {
                if (!isMatchable(segment)) {
                    continue;
                }
                if (sku.contains(segment) || title.contains(segment) || url.contains(segment)
                        || body.contains(segment)
                        || metaCodes.stream().anyMatch(code -> code.contains(segment))) {
                    loose.add(segment);
                }
            }
            if (!loose.isEmpty()) {
                return verdict(MatchType.FUZZY_MATCH, fuzzyConfidence(loose.size(), ref.parts().size()), loose,
                        "Only " + loose.size() + "/" + segments.size() + " composite parts found");
            }
        }

        log.debug("validation.noMatch reference={} url={}", canonical, page.url());
        return MatchVerdict.noMatch("Reference not found on page");
    }

    /**
     * Linear interpolation across the fuzzy band, rounded to three decimals so
     * band edges compare exactly.
     */
    static double fuzzyConfidence(int matched, int total) {
        double fraction = (double) matched / total;
        double min = MatchType.FUZZY_MATCH.minConfidence();
        double max = MatchType.FUZZY_MATCH.maxConfidence();
        double raw = min + (max - min) * fraction;
        return Math.round(raw * 1000.0) / 1000.0;
    }

    private boolean isMatchable(String segment) {
        return segment.length() >= config.minSegmentLength();
    }

    private MatchVerdict verdict(MatchType type, double confidence, List<String> parts, String reason) {
        MatchVerdict verdict = MatchVerdict.of(type, confidence, parts, reason, config.acceptThreshold());
        log.debug("validation.scored type={} confidence={} valid={}", type, confidence, verdict.isValid());
        return verdict;
    }

    public ValidationConfig getConfig() {
        return config;
    }
}
