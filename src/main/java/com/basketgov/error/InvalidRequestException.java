package com.basketgov.error;

/**
 * Domain-rule validation failure on caller input (unknown enum value,
 * malformed identifier, bad cursor).
 */
public class InvalidRequestException extends GovernanceException {

    public InvalidRequestException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "INVALID_REQUEST";
    }
}
