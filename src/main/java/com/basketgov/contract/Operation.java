package com.basketgov.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One substrate mutation: a type tag plus its arguments. Immutable once
 * attached to a proposal.
 */
public record Operation(
    @JsonProperty("type") OperationType type,
    @JsonProperty("data") Map<String, Object> data
) {

    public Operation {
        if (type == null) {
            throw new IllegalArgumentException("operation type is required");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Operation of(OperationType type, Map<String, Object> data) {
        return new Operation(type, data);
    }

    public String stringField(String name) {
        Object value = data.get(name);
        return value instanceof String text && !text.isBlank() ? text : null;
    }
}
