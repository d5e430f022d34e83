package com.basketgov.execution;

/**
 * An operation was well-formed but could not be applied to the current
 * substrate (missing target, target in another basket).
 */
public class OperationRejectedException extends RuntimeException {

    public OperationRejectedException(String message) {
        super(message);
    }
}
