package com.basketgov.work;

import com.basketgov.policy.ExecutionMode;
import com.basketgov.proposal.ProposalStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkOutcome(
    @JsonProperty("mode") ExecutionMode mode,
    @JsonProperty("reason") String reason,
    @JsonProperty("proposal_id") String proposalId,
    @JsonProperty("status") ProposalStatus status,
    @JsonProperty("commit_id") String commitId,
    @JsonProperty("operations_executed") Integer operationsExecuted,
    @JsonProperty("validator") String validator
) {
}
