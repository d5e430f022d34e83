package com.basketgov.policy;

/**
 * Result of asking the validator. {@link Unavailable} is never treated as a
 * passing report.
 */
public sealed interface ValidationOutcome {

    record Reported(ValidatorReport report) implements ValidationOutcome {}

    record Unavailable(String reason) implements ValidationOutcome {}

    default ValidatorReport reportOrNull() {
        return this instanceof Reported reported ? reported.report() : null;
    }
}
