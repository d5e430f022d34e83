package com.basketgov.error;

public class GovernanceDisabledException extends GovernanceException {

    public GovernanceDisabledException(String workspaceId) {
        super("Governance not enabled for workspace " + workspaceId);
    }

    @Override
    public String errorCode() {
        return "GOVERNANCE_DISABLED";
    }
}
