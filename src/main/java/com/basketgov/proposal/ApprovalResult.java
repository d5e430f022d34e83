package com.basketgov.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApprovalResult(
    @JsonProperty("proposal_id") String proposalId,
    @JsonProperty("commit_id") String commitId,
    @JsonProperty("operations_executed") int operationsExecuted,
    @JsonProperty("status") ProposalStatus status
) {
}
