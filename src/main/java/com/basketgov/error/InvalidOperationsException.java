package com.basketgov.error;

/**
 * Operation list is empty or contains an operation that cannot be applied
 * as written (unknown type, missing required field).
 */
public class InvalidOperationsException extends InvalidRequestException {

    public InvalidOperationsException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "INVALID_OPERATIONS";
    }
}
