package com.basketgov.api;

import com.basketgov.basket.BasketService;
import com.basketgov.contract.OperationContractValidator;
import com.basketgov.error.InvalidRequestException;
import com.basketgov.proposal.ProposalKind;
import com.basketgov.proposal.ProposalOrigin;
import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;
import com.basketgov.work.WorkOutcome;
import com.basketgov.work.WorkRequest;
import com.basketgov.work.WorkService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Routed substrate writes. The entry point's policy decides whether the
 * operations are applied now or parked as a proposal.
 */
@RestController
@RequestMapping("/v1/baskets/{basketId}/work")
public class WorkController {

    private final WorkService workService;
    private final BasketService basketService;
    private final OperationContractValidator operationValidator;

    public WorkController(WorkService workService,
                          BasketService basketService,
                          OperationContractValidator operationValidator) {
        this.workService = workService;
        this.basketService = basketService;
        this.operationValidator = operationValidator;
    }

    /**
     * Expected request body:
     * {
     *   "entry_point": "manual_edit",
     *   "proposal_kind": "Edit",
     *   "ops": [ ... ],
     *   "origin": "human" | "agent",   // optional
     *   "confidence": 0.9,             // optional
     *   "user_override": "allow_auto", // optional
     *   "blast_radius": "Local",       // optional
     *   "provenance": [ ... ]          // optional
     * }
     */
    @PostMapping
    public WorkOutcome submit(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                              @PathVariable String basketId,
                              @RequestBody Map<String, Object> body) {
        String basket = basketService.requireInWorkspace(RequestFields.requireUuid(basketId, "basket id"),
            caller.workspaceId()).id();

        String rawEntryPoint = RequestFields.requireString(body, "entry_point");
        EntryPoint entryPoint = EntryPoint.parse(rawEntryPoint)
            .orElseThrow(() -> new InvalidRequestException("Invalid entry_point: " + rawEntryPoint));
        String rawKind = RequestFields.requireString(body, "proposal_kind");
        ProposalKind kind = ProposalKind.parse(rawKind)
            .orElseThrow(() -> new InvalidRequestException("Invalid proposal_kind: " + rawKind));

        return workService.submit(new WorkRequest(
            basket,
            caller.workspaceId(),
            caller.userId(),
            entryPoint,
            operationValidator.parse(RequestFields.requireList(body, "ops")),
            kind,
            RequestFields.optionalEnum(body, "origin", ProposalOrigin::parse),
            RequestFields.optionalNumber(body, "confidence"),
            RequestFields.optionalString(body, "user_override"),
            RequestFields.optionalEnum(body, "blast_radius", BlastRadius::parse),
            RequestFields.stringList(body, "provenance")
        ));
    }
}
