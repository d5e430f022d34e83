package com.basketgov.error;

public class ForbiddenException extends GovernanceException {

    public ForbiddenException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "FORBIDDEN";
    }
}
