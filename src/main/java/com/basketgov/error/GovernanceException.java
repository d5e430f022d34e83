package com.basketgov.error;

/**
 * Root of the governance error taxonomy. Each subclass carries a stable
 * machine-readable code; the HTTP layer maps subclasses to status codes.
 */
public abstract class GovernanceException extends RuntimeException {

    protected GovernanceException(String message) {
        super(message);
    }

    protected GovernanceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
