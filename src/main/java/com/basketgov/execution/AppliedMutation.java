package com.basketgov.execution;

import com.basketgov.contract.OperationType;

import java.util.Map;

/**
 * A substrate change produced by one operation, described for the timeline.
 */
public record AppliedMutation(
    int operationIndex,
    OperationType operationType,
    String substrateId,
    String eventKind,
    Map<String, Object> details
) {

    public AppliedMutation {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
