package com.basketgov.error;

/**
 * Referenced basket or proposal does not exist, or lives outside the
 * caller's workspace.
 */
public class NotFoundException extends GovernanceException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException proposal(String proposalId) {
        return new NotFoundException("Proposal not found: " + proposalId);
    }

    public static NotFoundException basket(String basketId) {
        return new NotFoundException("Basket not found: " + basketId);
    }

    @Override
    public String errorCode() {
        return "NOT_FOUND";
    }
}
