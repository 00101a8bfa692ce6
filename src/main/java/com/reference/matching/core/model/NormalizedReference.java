package com.reference.matching.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Canonical form of a manufacturer reference code.
 * {@code parts} always starts with {@code canonical}; composite references
 * ({@code A+B}) append the canonical form of each joined segment in order.
 */
public record NormalizedReference(String canonical, List<String> parts) {

    public NormalizedReference {
        Objects.requireNonNull(canonical, "canonical is required");
        Objects.requireNonNull(parts, "parts is required");
        parts = List.copyOf(parts);
        if (parts.isEmpty() || !parts.get(0).equals(canonical)) {
            throw new IllegalArgumentException("parts must start with the canonical form");
        }
    }

    /**
     * Creates a single-part reference from an already canonical token.
     */
    public static NormalizedReference of(String canonical) {
        return new NormalizedReference(canonical, List.of(canonical));
    }

    /**
     * Returns true if the reference can be searched for (non-empty canonical form).
     */
    public boolean isSearchable() {
        return !canonical.isEmpty();
    }

    /**
     * Returns true if the raw reference joined several manufacturer codes.
     */
    public boolean isComposite() {
        return parts.size() > 1;
    }

    /**
     * Returns the individual segments of a composite reference, or the canonical
     * form alone for a simple one.
     */
    public List<String> segments() {
        return isComposite() ? parts.subList(1, parts.size()) : parts;
    }
}
