package com.basketgov.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of substrate operations a proposal may carry. Handlers are
 * dispatched with exhaustive switches, so adding a constant here fails
 * compilation until every dispatch site handles it.
 */
public enum OperationType {
    CREATE_BLOCK("CreateBlock"),
    CREATE_CONTEXT_ITEM("CreateContextItem"),
    CREATE_RAW_DUMP("CreateRawDump"),
    REVISE_BLOCK("ReviseBlock"),
    UPDATE_CONTEXT_ITEM("UpdateContextItem"),
    MERGE_CONTEXT_ITEMS("MergeContextItems"),
    ATTACH_BLOCK_TO_DOC("AttachBlockToDoc"),
    PROMOTE_SCOPE("PromoteScope");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<OperationType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw.trim()))
            .findFirst();
    }

    @JsonCreator
    public static OperationType fromValue(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Unknown operation type: " + raw));
    }
}
