package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Declared scope of impact for a change. Informational: carried on
 * proposals and returned unchanged, never enforced.
 */
public enum BlastRadius {
    LOCAL("Local"),
    SCOPED("Scoped"),
    GLOBAL("Global");

    private final String value;

    BlastRadius(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<BlastRadius> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw.trim()))
            .findFirst();
    }

    @JsonCreator
    public static BlastRadius fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown blast radius: " + raw));
    }
}
