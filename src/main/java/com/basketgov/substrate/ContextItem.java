package com.basketgov.substrate;

import java.time.Instant;
import java.util.List;

public record ContextItem(
    String id,
    String basketId,
    String label,
    String kind,
    double confidence,
    String state,
    List<String> synonyms,
    Instant updatedAt
) {

    public static final String ACTIVE = "ACTIVE";
    public static final String MERGED = "MERGED";

    public ContextItem {
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    public ContextItem update(String newLabel, String newKind, double newConfidence,
                              List<String> newSynonyms, Instant at) {
        return new ContextItem(id, basketId, newLabel, newKind, newConfidence, state, newSynonyms, at);
    }

    public ContextItem mergedInto(Instant at) {
        return new ContextItem(id, basketId, label, kind, confidence, MERGED, synonyms, at);
    }
}
