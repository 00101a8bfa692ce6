package com.reference.matching.api;

import com.reference.matching.core.model.MatchVerdict;
import com.reference.matching.core.model.NormalizedReference;

import java.util.Objects;

/**
 * Outcome of looking up one reference in one store.
 */
public record LookupResult(String storeId, NormalizedReference reference, MatchVerdict verdict,
                           boolean fromCache) {

    public LookupResult {
        Objects.requireNonNull(storeId, "storeId is required");
        Objects.requireNonNull(reference, "reference is required");
        Objects.requireNonNull(verdict, "verdict is required");
    }

    public boolean isFound() {
        return verdict.isValid();
    }
}
