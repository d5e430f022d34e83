package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Policy {
    PROPOSAL("proposal"),
    DIRECT("direct"),
    HYBRID("hybrid");

    private final String value;

    Policy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<Policy> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw.trim()))
            .findFirst();
    }

    @JsonCreator
    public static Policy fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown policy: " + raw));
    }
}
