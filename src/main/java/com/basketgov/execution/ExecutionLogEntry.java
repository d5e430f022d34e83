package com.basketgov.execution;

import com.basketgov.contract.OperationType;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionLogEntry(
    @JsonProperty("operation_index") int operationIndex,
    @JsonProperty("operation_type") OperationType operationType,
    @JsonProperty("success") boolean success,
    @JsonProperty("substrate_id") String substrateId,
    @JsonProperty("execution_time_ms") long executionTimeMs,
    @JsonProperty("error_message") String errorMessage
) {
}
