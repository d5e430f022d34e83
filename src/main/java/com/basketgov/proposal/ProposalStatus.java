package com.basketgov.proposal;

import java.util.Arrays;
import java.util.Optional;

/**
 * PROPOSED is the only non-terminal state.
 */
public enum ProposalStatus {
    PROPOSED,
    APPROVED,
    REJECTED;

    public String getValue() {
        return name();
    }

    public static Optional<ProposalStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(v -> v.name().equals(raw.trim())).findFirst();
    }
}
