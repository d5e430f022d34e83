package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Coarse summary of how strongly a workspace is governed, for display.
 */
public record GovernanceStatus(
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("status") String status,
    @JsonProperty("description") String description,
    @JsonProperty("flags") GovernanceFlags flags
) {

    public static GovernanceStatus of(String workspaceId, GovernanceFlags flags) {
        if (!flags.governanceEnabled()) {
            return new GovernanceStatus(workspaceId, "disabled",
                "Governance not active - legacy substrate writes only", flags);
        }
        if (flags.validatorRequired() && !flags.directSubstrateWrites()) {
            return new GovernanceStatus(workspaceId, "full",
                "Full governance - all substrate writes governed", flags);
        }
        if (flags.governanceUiEnabled()) {
            return new GovernanceStatus(workspaceId, "partial",
                "Governance UI active - some flows governed", flags);
        }
        return new GovernanceStatus(workspaceId, "testing",
            "Governance enabled for testing - parallel to legacy writes", flags);
    }
}
