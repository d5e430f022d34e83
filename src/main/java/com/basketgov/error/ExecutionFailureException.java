package com.basketgov.error;

/**
 * The operation batch could not be applied atomically; nothing was
 * committed.
 */
public class ExecutionFailureException extends GovernanceException {

    private final int failedOperationIndex;

    public ExecutionFailureException(String reason, int failedOperationIndex, Throwable cause) {
        super(reason, cause);
        this.failedOperationIndex = failedOperationIndex;
    }

    public int getFailedOperationIndex() {
        return failedOperationIndex;
    }

    @Override
    public String errorCode() {
        return "EXECUTION_FAILED";
    }
}
