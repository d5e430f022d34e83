package com.basketgov.proposal;

import com.basketgov.contract.OperationContractValidator;
import com.basketgov.error.AlreadyExecutedException;
import com.basketgov.error.ConflictException;
import com.basketgov.error.InvalidStateException;
import com.basketgov.error.NotFoundException;
import com.basketgov.execution.ExecutionEngine;
import com.basketgov.execution.ExecutionResult;
import com.basketgov.execution.ExecutionScope;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.GovernanceFlags;
import com.basketgov.settings.GovernanceSettingsResolver;
import com.basketgov.timeline.TimelineEmitter;
import com.basketgov.timeline.TimelineKinds;
import com.basketgov.timeline.TimelineOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Proposal lifecycle: PROPOSED to APPROVED (executing its operations
 * exactly once) or to REJECTED. Both are terminal.
 *
 * Approval holds the proposal's row lock across execution and the status
 * write, so of two concurrent approvals one executes and the other sees
 * {@link AlreadyExecutedException}.
 */
public class ProposalService {

    private static final Logger log = LoggerFactory.getLogger(ProposalService.class);

    static final double DEFAULT_CONFIDENCE = 0.5;

    private final ProposalStore store;
    private final ExecutionEngine executionEngine;
    private final OperationContractValidator operationValidator;
    private final TimelineEmitter timeline;
    private final GovernanceSettingsResolver settingsResolver;
    private final Clock clock;

    public ProposalService(ProposalStore store,
                           ExecutionEngine executionEngine,
                           OperationContractValidator operationValidator,
                           TimelineEmitter timeline,
                           GovernanceSettingsResolver settingsResolver,
                           Clock clock) {
        this.store = store;
        this.executionEngine = executionEngine;
        this.operationValidator = operationValidator;
        this.timeline = timeline;
        this.settingsResolver = settingsResolver;
        this.clock = clock;
    }

    public Proposal create(NewProposal request) {
        operationValidator.validate(request.ops());

        GovernanceFlags flags = settingsResolver.resolve(request.workspaceId());
        BlastRadius blastRadius = request.blastRadius() != null
            ? request.blastRadius()
            : flags.defaultBlastRadius();

        Proposal proposal = new Proposal(
            UUID.randomUUID().toString(),
            request.basketId(),
            request.workspaceId(),
            request.proposalKind(),
            request.origin() != null ? request.origin() : ProposalOrigin.HUMAN,
            ProposalStatus.PROPOSED,
            request.ops(),
            request.validatorReport(),
            confidenceOf(request),
            blastRadius,
            false,
            Instant.now(clock),
            request.provenance(),
            request.entryPoint(),
            null, null, null, null, null, null
        );
        store.insert(proposal);

        log.info("Proposal created id={} basket={} kind={} ops={}",
            proposal.id(), proposal.basketId(), proposal.proposalKind().getValue(), proposal.ops().size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("proposal_id", proposal.id());
        payload.put("proposal_kind", proposal.proposalKind().getValue());
        payload.put("origin", proposal.origin().getValue());
        payload.put("ops_count", proposal.ops().size());
        payload.put("ops_summary", proposal.opsSummary());
        payload.put("blast_radius", proposal.blastRadius().getValue());
        if (proposal.entryPoint() != null) {
            payload.put("entry_point", proposal.entryPoint().getValue());
        }
        timeline.emit(proposal.basketId(), TimelineKinds.PROPOSAL_CREATED, proposal.id(), payload,
            request.actorId(), proposal.origin().timelineOrigin());
        return proposal;
    }

    public ApprovalResult approve(String basketId, String proposalId, String reviewerId, String reviewNotes) {
        return approve(basketId, proposalId, reviewerId, reviewNotes, TimelineOrigin.USER);
    }

    /**
     * Creates and immediately approves a proposal, so direct writes are still
     * recorded as executed proposals.
     */
    public ApprovalResult autoApprove(NewProposal request) {
        Proposal proposal = create(request);
        TimelineOrigin origin = proposal.origin() == ProposalOrigin.AGENT ? TimelineOrigin.AGENT : TimelineOrigin.SYSTEM;
        return approve(proposal.basketId(), proposal.id(), request.actorId(), Proposal.AUTO_APPROVED_NOTE, origin);
    }

    public Proposal reject(String basketId, String proposalId, String reviewerId, String reason) {
        try (ProposalStore.ProposalLock ignored = store.lock(proposalId)) {
            Proposal proposal = load(basketId, proposalId);
            if (proposal.isExecuted()) {
                throw ConflictException.executedProposalRejection();
            }
            if (proposal.status() != ProposalStatus.PROPOSED) {
                throw new InvalidStateException("reject", proposalId, proposal.status().getValue());
            }

            Instant now = Instant.now(clock);
            if (!store.updateIfNotExecuted(proposalId, p -> p.rejected(reviewerId, now, reason))) {
                throw ConflictException.executedProposalRejection();
            }
            Proposal rejected = load(basketId, proposalId);
            log.info("Proposal rejected id={} basket={} by={}", proposalId, basketId, reviewerId);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("proposal_id", proposalId);
            payload.put("reason", reason);
            payload.put("proposal_kind", rejected.proposalKind().getValue());
            timeline.emit(basketId, TimelineKinds.PROPOSAL_REJECTED, proposalId, payload,
                reviewerId, TimelineOrigin.USER);
            return rejected;
        }
    }

    public List<Proposal> list(String basketId, ProposalStatus status, ProposalKind kind) {
        return store.list(basketId, status, kind);
    }

    public Proposal get(String basketId, String proposalId) {
        return load(basketId, proposalId);
    }

    private ApprovalResult approve(String basketId, String proposalId, String reviewerId,
                                   String reviewNotes, TimelineOrigin origin) {
        try (ProposalStore.ProposalLock ignored = store.lock(proposalId)) {
            Proposal proposal = load(basketId, proposalId);
            if (proposal.isExecuted()) {
                throw new AlreadyExecutedException(proposalId);
            }
            if (proposal.status() != ProposalStatus.PROPOSED) {
                throw new InvalidStateException("approve", proposalId, proposal.status().getValue());
            }

            ExecutionResult result = executionEngine.execute(proposal.ops(), new ExecutionScope(
                basketId, proposal.workspaceId(), proposalId, reviewerId, origin));

            Instant now = Instant.now(clock);
            if (!store.updateIfNotExecuted(proposalId, p -> p.approved(reviewerId, now, reviewNotes, result))) {
                throw new AlreadyExecutedException(proposalId);
            }
            log.info("Proposal approved id={} basket={} commit={} ops={}",
                proposalId, basketId, result.commitId(), result.operationsExecuted());

            emitApproval(proposal, result, reviewerId, reviewNotes, origin);
            return new ApprovalResult(proposalId, result.commitId(), result.operationsExecuted(),
                ProposalStatus.APPROVED);
        }
    }

    private void emitApproval(Proposal proposal, ExecutionResult result, String reviewerId,
                              String reviewNotes, TimelineOrigin origin) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("proposal_id", proposal.id());
        payload.put("commit_id", result.commitId());
        payload.put("operations_executed", result.operationsExecuted());
        payload.put("proposal_kind", proposal.proposalKind().getValue());
        if (reviewNotes != null) {
            payload.put("review_notes", reviewNotes);
        }
        timeline.emit(proposal.basketId(), TimelineKinds.PROPOSAL_APPROVED, proposal.id(), payload,
            reviewerId, origin);

        GovernanceFlags flags = settingsResolver.resolve(proposal.workspaceId());
        if (flags.cascadeEventsEnabled()) {
            Map<String, Object> committed = new LinkedHashMap<>();
            committed.put("commit_id", result.commitId());
            committed.put("proposal_id", proposal.id());
            committed.put("operations_executed", result.operationsExecuted());
            committed.put("ops_summary", proposal.opsSummary());
            timeline.emit(proposal.basketId(), TimelineKinds.SUBSTRATE_COMMITTED, result.commitId(), committed,
                reviewerId, TimelineOrigin.SYSTEM);
        }
    }

    private Proposal load(String basketId, String proposalId) {
        return store.findById(proposalId)
            .filter(p -> p.basketId().equals(basketId))
            .orElseThrow(() -> NotFoundException.proposal(proposalId));
    }

    private static double confidenceOf(NewProposal request) {
        if (request.confidence() != null) {
            return request.confidence();
        }
        if (request.validatorReport() != null) {
            return request.validatorReport().confidence();
        }
        return DEFAULT_CONFIDENCE;
    }
}
