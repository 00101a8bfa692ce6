package com.reference.matching.rules;

import com.reference.matching.core.model.NormalizedReference;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts raw manufacturer references into {@link NormalizedReference}s.
 *
 * <p>Normalization is total and pure: any input yields a result, identical input
 * always yields identical output, and the canonical form is a fixed point
 * ({@code normalize(normalize(s).canonical()).canonical() == normalize(s).canonical()}).
 * The canonical form is used as a persistent cache key, so the character set is
 * fixed: ASCII letters and digits, upper-cased with {@link Locale#ROOT}. Accented
 * letters and every separator are dropped.</p>
 *
 * <p>References joined with {@code +} are composite: each segment is canonicalized
 * separately and appended after the canonical form.</p>
 */
public class ReferenceNormalizer {

    private static final Pattern NON_CANONICAL = Pattern.compile("[^A-Za-z0-9]+");
    private static final Pattern COMPOSITE_DELIMITER = Pattern.compile("\\s*\\+\\s*");
    private static final Pattern CODE_TOKEN = Pattern.compile("\\b([A-Za-z0-9][\\w\\-.]*)\\b");

    /**
     * Normalizes a raw reference. Empty, blank or null input yields an
     * unsearchable reference with an empty canonical form.
     */
    public NormalizedReference normalize(String raw) {
        String canonical = canonicalize(raw);
        if (canonical.isEmpty() || raw.indexOf('+') < 0) {
            return NormalizedReference.of(canonical);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : COMPOSITE_DELIMITER.split(raw)) {
            String normalized = canonicalize(segment);
            if (!normalized.isEmpty()) {
                segments.add(normalized);
            }
        }
        // "ABC+" or "+ABC" is a simple reference with a stray delimiter
        if (segments.size() < 2) {
            return NormalizedReference.of(canonical);
        }

        List<String> parts = new ArrayList<>(segments.size() + 1);
        parts.add(canonical);
        parts.addAll(segments);
        return new NormalizedReference(canonical, parts);
    }

    /**
     * Returns the canonical form of a single token: upper case, letters and digits only.
     */
    public String canonicalize(String token) {
        if (token == null || token.isBlank()) {
            return "";
        }
        return NON_CANONICAL.matcher(token).replaceAll("").toUpperCase(Locale.ROOT);
    }

    /**
     * Checks if two references share the same canonical form.
     */
    public boolean areEquivalent(String reference1, String reference2) {
        return canonicalize(reference1).equals(canonicalize(reference2));
    }

    /**
     * Extracts the distinct canonical codes found in free text, in order of first
     * appearance. Codes shorter than {@code minLength} after canonicalization are skipped.
     */
    public List<String> extractCodes(String text, int minLength) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> codes = new LinkedHashSet<>();
        Matcher matcher = CODE_TOKEN.matcher(text);
        while (matcher.find()) {
            String code = canonicalize(matcher.group(1));
            if (code.length() >= Math.max(1, minLength)) {
                codes.add(code);
            }
        }
        return List.copyOf(codes);
    }
}
