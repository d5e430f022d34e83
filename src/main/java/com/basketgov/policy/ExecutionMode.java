package com.basketgov.policy;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionMode {
    DIRECT("direct"),
    PROPOSAL("proposal");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
