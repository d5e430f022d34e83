package com.basketgov.error;

/**
 * A proposal state-machine rule was violated. The message always names the
 * conflicting condition.
 */
public class ConflictException extends GovernanceException {

    public ConflictException(String message) {
        super(message);
    }

    public static ConflictException executedProposalRejection() {
        return new ConflictException("Cannot reject executed proposal");
    }

    @Override
    public String errorCode() {
        return "CONFLICT";
    }
}
