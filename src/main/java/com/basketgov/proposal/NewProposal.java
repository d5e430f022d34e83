package com.basketgov.proposal;

import com.basketgov.contract.Operation;
import com.basketgov.policy.ValidatorReport;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;

import java.util.List;

/**
 * Input to {@link ProposalService#create}. Optional fields may be null.
 */
public record NewProposal(
    String basketId,
    String workspaceId,
    ProposalKind proposalKind,
    ProposalOrigin origin,
    List<Operation> ops,
    ValidatorReport validatorReport,
    Double confidence,
    BlastRadius blastRadius,
    List<String> provenance,
    EntryPoint entryPoint,
    String actorId
) {
}
