package com.basketgov.work;

import com.basketgov.contract.Operation;
import com.basketgov.proposal.ProposalKind;
import com.basketgov.proposal.ProposalOrigin;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;

import java.util.List;

/**
 * A substrate change arriving through one entry point, before routing.
 */
public record WorkRequest(
    String basketId,
    String workspaceId,
    String actorId,
    EntryPoint entryPoint,
    List<Operation> ops,
    ProposalKind proposalKind,
    ProposalOrigin origin,
    Double confidence,
    String userOverride,
    BlastRadius blastRadius,
    List<String> provenance
) {
}
