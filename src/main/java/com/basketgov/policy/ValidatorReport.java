package com.basketgov.policy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of a validator run over a set of operations.
 *
 * @param confidence    score in [0, 1]
 * @param impactSummary human-readable impact description
 * @param warnings      free-form validator warnings
 */
public record ValidatorReport(
    @JsonProperty("confidence") double confidence,
    @JsonProperty("impact_summary") String impactSummary,
    @JsonProperty("warnings") List<String> warnings
) {

    public ValidatorReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isWellFormed() {
        return Double.isFinite(confidence) && confidence >= 0.0 && confidence <= 1.0
            && impactSummary != null && !impactSummary.isBlank();
    }
}
