package com.basketgov.proposal;

import com.basketgov.timeline.TimelineOrigin;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ProposalOrigin {
    HUMAN("human"),
    AGENT("agent");

    private final String value;

    ProposalOrigin(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public TimelineOrigin timelineOrigin() {
        return this == AGENT ? TimelineOrigin.AGENT : TimelineOrigin.USER;
    }

    public static Optional<ProposalOrigin> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.value.equals(raw.trim())).findFirst();
    }
}
