package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Named call site whose policy decides how a substrate change is routed.
 */
public enum EntryPoint {
    ONBOARDING_DUMP("onboarding_dump"),
    MANUAL_EDIT("manual_edit"),
    DOCUMENT_EDIT("document_edit"),
    REFLECTION_SUGGESTION("reflection_suggestion"),
    GRAPH_ACTION("graph_action"),
    TIMELINE_RESTORE("timeline_restore");

    private final String value;

    EntryPoint(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Environment variable carrying the default policy for this entry point. */
    public String environmentKey() {
        return "EP_" + name();
    }

    public static Optional<EntryPoint> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw.trim()))
            .findFirst();
    }

    @JsonCreator
    public static EntryPoint fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown entry point: " + raw));
    }
}
