package com.basketgov.proposal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ProposalKind {
    EXTRACTION("Extraction"),
    EDIT("Edit"),
    MERGE("Merge"),
    ATTACHMENT("Attachment"),
    SCOPE_PROMOTION("ScopePromotion"),
    DEPRECATION("Deprecation"),
    REVISION("Revision"),
    DETACH("Detach"),
    RENAME("Rename"),
    CONTEXT_ALIAS("ContextAlias"),
    CAPTURE("Capture");

    private final String value;

    ProposalKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Optional<ProposalKind> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.value.equals(raw.trim())).findFirst();
    }
}
