package com.basketgov.work;

import com.basketgov.contract.OperationContractValidator;
import com.basketgov.policy.ExecutionMode;
import com.basketgov.policy.PolicyResolver;
import com.basketgov.policy.RoutingDecision;
import com.basketgov.policy.ValidationOutcome;
import com.basketgov.policy.ValidationRequest;
import com.basketgov.policy.ValidatorGateway;
import com.basketgov.policy.ValidatorReport;
import com.basketgov.proposal.ApprovalResult;
import com.basketgov.proposal.NewProposal;
import com.basketgov.proposal.Proposal;
import com.basketgov.proposal.ProposalService;
import com.basketgov.settings.GovernanceFlags;
import com.basketgov.settings.GovernanceSettingsResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry for substrate changes: resolve settings, consult the
 * validator when governance is on, route, then either execute at once
 * (as an auto-approved proposal) or park a proposal for review.
 */
public class WorkService {

    private static final Logger log = LoggerFactory.getLogger(WorkService.class);

    private final GovernanceSettingsResolver settingsResolver;
    private final PolicyResolver policyResolver;
    private final ValidatorGateway validatorGateway;
    private final ProposalService proposalService;
    private final OperationContractValidator operationValidator;

    public WorkService(GovernanceSettingsResolver settingsResolver,
                       PolicyResolver policyResolver,
                       ValidatorGateway validatorGateway,
                       ProposalService proposalService,
                       OperationContractValidator operationValidator) {
        this.settingsResolver = settingsResolver;
        this.policyResolver = policyResolver;
        this.validatorGateway = validatorGateway;
        this.proposalService = proposalService;
        this.operationValidator = operationValidator;
    }

    public WorkOutcome submit(WorkRequest request) {
        operationValidator.validate(request.ops());
        GovernanceFlags flags = settingsResolver.resolve(request.workspaceId());

        ValidationOutcome validation = null;
        if (flags.governanceEnabled()) {
            validation = validatorGateway.validate(new ValidationRequest(
                request.basketId(), request.workspaceId(), request.proposalKind().getValue(), request.ops()));
        }
        ValidatorReport report = validation != null ? validation.reportOrNull() : null;
        Double confidence = request.confidence() != null
            ? request.confidence()
            : report != null ? Double.valueOf(report.confidence()) : null;

        RoutingDecision decision = policyResolver.decide(request.entryPoint(), flags, confidence,
            request.userOverride(), report, request.blastRadius());
        log.info("Work routed basket={} entry_point={} mode={} reason={}",
            request.basketId(), request.entryPoint().getValue(), decision.mode().getValue(), decision.reason());

        NewProposal proposal = new NewProposal(
            request.basketId(),
            request.workspaceId(),
            request.proposalKind(),
            request.origin(),
            request.ops(),
            report,
            confidence,
            decision.effectiveBlastRadius(),
            request.provenance(),
            request.entryPoint(),
            request.actorId()
        );
        String validatorState = validatorState(validation);

        if (decision.mode() == ExecutionMode.DIRECT) {
            ApprovalResult result = proposalService.autoApprove(proposal);
            return new WorkOutcome(decision.mode(), decision.reason(), result.proposalId(), result.status(),
                result.commitId(), result.operationsExecuted(), validatorState);
        }
        Proposal created = proposalService.create(proposal);
        return new WorkOutcome(decision.mode(), decision.reason(), created.id(), created.status(),
            null, null, validatorState);
    }

    private static String validatorState(ValidationOutcome outcome) {
        if (outcome == null) {
            return "skipped";
        }
        return outcome instanceof ValidationOutcome.Reported ? "reported" : "unavailable";
    }
}
