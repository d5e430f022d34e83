package com.basketgov.error;

public class AlreadyExecutedException extends ConflictException {

    public AlreadyExecutedException(String proposalId) {
        super("Proposal already executed: " + proposalId);
    }

    @Override
    public String errorCode() {
        return "ALREADY_EXECUTED";
    }
}
