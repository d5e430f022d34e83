package com.basketgov.execution;

import java.util.List;

public record ExecutionResult(
    String commitId,
    int operationsExecuted,
    List<AppliedMutation> mutations,
    List<ExecutionLogEntry> executionLog
) {

    public ExecutionResult {
        mutations = List.copyOf(mutations);
        executionLog = List.copyOf(executionLog);
    }
}
