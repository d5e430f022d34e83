package com.basketgov.api;

import com.basketgov.basket.BasketService;
import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationContractValidator;
import com.basketgov.error.GovernanceDisabledException;
import com.basketgov.error.InvalidRequestException;
import com.basketgov.policy.ValidationRequest;
import com.basketgov.policy.ValidatorGateway;
import com.basketgov.policy.ValidatorReport;
import com.basketgov.proposal.ApprovalResult;
import com.basketgov.proposal.NewProposal;
import com.basketgov.proposal.Proposal;
import com.basketgov.proposal.ProposalKind;
import com.basketgov.proposal.ProposalOrigin;
import com.basketgov.proposal.ProposalService;
import com.basketgov.proposal.ProposalStatus;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;
import com.basketgov.settings.GovernanceFlags;
import com.basketgov.settings.GovernanceSettingsResolver;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Proposal review endpoints for one basket.
 */
@RestController
@RequestMapping("/v1/baskets/{basketId}/proposals")
public class ProposalController {

    private final ProposalService proposalService;
    private final BasketService basketService;
    private final OperationContractValidator operationValidator;
    private final GovernanceSettingsResolver settingsResolver;
    private final ValidatorGateway validatorGateway;

    public ProposalController(ProposalService proposalService,
                              BasketService basketService,
                              OperationContractValidator operationValidator,
                              GovernanceSettingsResolver settingsResolver,
                              ValidatorGateway validatorGateway) {
        this.proposalService = proposalService;
        this.basketService = basketService;
        this.operationValidator = operationValidator;
        this.settingsResolver = settingsResolver;
        this.validatorGateway = validatorGateway;
    }

    /**
     * Expected request body:
     * {
     *   "proposal_kind": "Extraction",
     *   "ops": [ { "type": "CreateBlock", "data": { "content": "..." } } ],
     *   "origin": "human" | "agent",        // optional, defaults to "human"
     *   "confidence": 0.7,                  // optional
     *   "blast_radius": "Local",            // optional, workspace default otherwise
     *   "entry_point": "manual_edit",       // optional
     *   "provenance": ["dump-id"],          // optional
     *   "validator_report": { ... }         // optional
     * }
     */
    @PostMapping
    public Map<String, Object> create(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                      @PathVariable String basketId,
                                      @RequestBody Map<String, Object> body) {
        String basket = requireBasket(caller, basketId);

        String rawKind = RequestFields.requireString(body, "proposal_kind");
        ProposalKind kind = ProposalKind.parse(rawKind)
            .orElseThrow(() -> new InvalidRequestException("Invalid proposal_kind: " + rawKind));
        List<Operation> ops = operationValidator.parse(RequestFields.requireList(body, "ops"));
        ProposalOrigin origin = RequestFields.optionalEnum(body, "origin", ProposalOrigin::parse);
        BlastRadius blastRadius = RequestFields.optionalEnum(body, "blast_radius", BlastRadius::parse);
        EntryPoint entryPoint = RequestFields.optionalEnum(body, "entry_point", EntryPoint::parse);
        Double confidence = RequestFields.optionalNumber(body, "confidence");
        ValidatorReport report = validatorReport(body.get("validator_report"));

        GovernanceFlags flags = requireGovernance(caller);
        if (report == null && flags.validatorRequired()) {
            report = validatorGateway.validate(new ValidationRequest(basket, caller.workspaceId(),
                kind.getValue(), ops)).reportOrNull();
        }

        Proposal proposal = proposalService.create(new NewProposal(
            basket,
            caller.workspaceId(),
            kind,
            origin,
            ops,
            report,
            confidence,
            blastRadius,
            RequestFields.stringList(body, "provenance"),
            entryPoint,
            caller.userId()
        ));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("proposal_id", proposal.id());
        response.put("status", proposal.status().getValue());
        return response;
    }

    @GetMapping
    public Map<String, Object> list(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                    @PathVariable String basketId,
                                    @RequestParam(required = false) String status,
                                    @RequestParam(required = false) String kind) {
        String basket = requireBasket(caller, basketId);
        ProposalStatus statusFilter = status == null ? null : ProposalStatus.parse(status)
            .orElseThrow(() -> new InvalidRequestException("Invalid status: " + status));
        ProposalKind kindFilter = kind == null ? null : ProposalKind.parse(kind)
            .orElseThrow(() -> new InvalidRequestException("Invalid kind: " + kind));
        requireGovernance(caller);

        return Map.of("items", proposalService.list(basket, statusFilter, kindFilter));
    }

    @GetMapping("/{proposalId}")
    public Proposal get(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                        @PathVariable String basketId,
                        @PathVariable String proposalId) {
        String basket = requireBasket(caller, basketId);
        return proposalService.get(basket, RequestFields.requireUuid(proposalId, "proposal id"));
    }

    @PostMapping("/{proposalId}/approve")
    public Map<String, Object> approve(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                       @PathVariable String basketId,
                                       @PathVariable String proposalId,
                                       @RequestBody(required = false) Map<String, Object> body) {
        String basket = requireBasket(caller, basketId);
        String notes = body == null ? null : RequestFields.optionalString(body, "review_notes");

        ApprovalResult result = proposalService.approve(basket,
            RequestFields.requireUuid(proposalId, "proposal id"), caller.userId(), notes);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("commit_id", result.commitId());
        response.put("operations_executed", result.operationsExecuted());
        return response;
    }

    @PostMapping("/{proposalId}/reject")
    public Map<String, Object> reject(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                                      @PathVariable String basketId,
                                      @PathVariable String proposalId,
                                      @RequestBody Map<String, Object> body) {
        String basket = requireBasket(caller, basketId);
        String reason = RequestFields.requireString(body, "reason");

        Proposal rejected = proposalService.reject(basket,
            RequestFields.requireUuid(proposalId, "proposal id"), caller.userId(), reason);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("status", rejected.status().getValue());
        return response;
    }

    private String requireBasket(CallerContext caller, String basketId) {
        return basketService.requireInWorkspace(RequestFields.requireUuid(basketId, "basket id"),
            caller.workspaceId()).id();
    }

    private GovernanceFlags requireGovernance(CallerContext caller) {
        GovernanceFlags flags = settingsResolver.resolve(caller.workspaceId());
        if (!flags.governanceEnabled()) {
            throw new GovernanceDisabledException(caller.workspaceId());
        }
        return flags;
    }

    private static ValidatorReport validatorReport(Object raw) {
        if (raw == null) {
            return null;
        }
        if (!(raw instanceof Map<?, ?> map) || !(map.get("confidence") instanceof Number confidence)) {
            throw new InvalidRequestException("validator_report must be an object with a numeric confidence");
        }
        Object summary = map.get("impact_summary");
        List<String> warnings = map.get("warnings") instanceof List<?> items
            ? items.stream().map(String::valueOf).toList()
            : List.of();
        return new ValidatorReport(confidence.doubleValue(), summary == null ? null : String.valueOf(summary),
            warnings);
    }
}
