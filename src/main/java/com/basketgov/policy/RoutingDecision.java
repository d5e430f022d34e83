package com.basketgov.policy;

import com.basketgov.settings.BlastRadius;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of routing a work request. {@code reason} is a stable,
 * colon-separated audit string such as {@code ep_policy_hybrid:manual_edit:low_confidence}.
 */
public record RoutingDecision(
    @JsonProperty("mode") ExecutionMode mode,
    @JsonProperty("reason") String reason,
    @JsonProperty("effective_blast_radius") BlastRadius effectiveBlastRadius
) {
}
