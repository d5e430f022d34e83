package com.basketgov.timeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TimelineOrigin {
    USER("user"),
    SYSTEM("system"),
    AGENT("agent");

    private final String value;

    TimelineOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
