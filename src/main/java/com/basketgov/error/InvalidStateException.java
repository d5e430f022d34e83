package com.basketgov.error;

public class InvalidStateException extends ConflictException {

    public InvalidStateException(String action, String proposalId, String status) {
        super("Cannot " + action + " proposal " + proposalId + " in " + status + " state");
    }

    @Override
    public String errorCode() {
        return "INVALID_STATE";
    }
}
