package com.basketgov.api;

import com.basketgov.error.InvalidRequestException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Field extraction for loosely-typed JSON request bodies.
 */
final class RequestFields {

    private RequestFields() {
    }

    static String requireString(Map<String, Object> body, String field) {
        String value = optionalString(body, field);
        if (value == null) {
            throw new InvalidRequestException(field + " is required");
        }
        return value;
    }

    static String optionalString(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new InvalidRequestException(field + " must be a string");
        }
        return text.isBlank() ? null : text.trim();
    }

    static Double optionalNumber(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new InvalidRequestException(field + " must be a number");
        }
        return number.doubleValue();
    }

    static List<String> stringList(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new InvalidRequestException(field + " must be an array");
        }
        List<String> result = new ArrayList<>(items.size());
        for (Object item : items) {
            result.add(String.valueOf(item));
        }
        return result;
    }

    static List<?> requireList(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (!(value instanceof List<?> items)) {
            throw new InvalidRequestException(field + " must be an array");
        }
        return items;
    }

    /**
     * Parses an optional enum-valued field; an unrecognised value is a 400.
     */
    static <T> T optionalEnum(Map<String, Object> body, String field, Function<String, Optional<T>> parser) {
        String raw = optionalString(body, field);
        if (raw == null) {
            return null;
        }
        return parser.apply(raw).orElseThrow(() -> new InvalidRequestException("Invalid " + field + ": " + raw));
    }

    static String requireUuid(String raw, String name) {
        try {
            UUID.fromString(raw);
            return raw;
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("Invalid " + name + ": " + raw);
        }
    }
}
