package com.basketgov.integration;

import com.basketgov.basket.Basket;
import com.basketgov.basket.BasketService;
import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationType;
import com.basketgov.error.ConflictException;
import com.basketgov.error.InvalidStateException;
import com.basketgov.proposal.ApprovalResult;
import com.basketgov.proposal.NewProposal;
import com.basketgov.proposal.Proposal;
import com.basketgov.proposal.ProposalKind;
import com.basketgov.proposal.ProposalOrigin;
import com.basketgov.proposal.ProposalService;
import com.basketgov.proposal.ProposalStatus;
import com.basketgov.settings.EntryPoint;
import com.basketgov.settings.GovernanceSettingsService;
import com.basketgov.substrate.SubstrateStore;
import com.basketgov.timeline.TimelineEmitter;
import com.basketgov.timeline.TimelineEvent;
import com.basketgov.timeline.TimelineKinds;
import com.basketgov.timeline.TimelineQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rejection path:
 *
 * agent proposal -> rejected (terminal, nothing applied) -> revised
 * proposal -> approved -> a late reject of the executed one is refused
 */
@SpringBootTest
class RejectionPathIntegrationTest {

    @Autowired BasketService baskets;
    @Autowired GovernanceSettingsService settings;
    @Autowired ProposalService proposals;
    @Autowired SubstrateStore substrate;
    @Autowired TimelineEmitter timeline;

    @Test
    @DisplayName("Rejection path: reject -> re-propose -> approve -> late reject refused")
    void rejectionPath_reproposeAndApprove() {
        String workspace = "ws-reject-" + UUID.randomUUID().toString().substring(0, 8);
        Basket basket = baskets.create(workspace, "Hiring");
        settings.update(workspace, Map.of("governance_enabled", true), "admin-1");

        // 1. Agent suggests a block; reviewer rejects it
        Proposal first = proposals.create(agentProposal(basket, workspace, "Hire 10 people next week"));
        Proposal rejected = proposals.reject(basket.id(), first.id(), "reviewer-1", "unrealistic timeline");
        assertEquals(ProposalStatus.REJECTED, rejected.status());
        assertFalse(rejected.isExecuted());
        assertTrue(substrate.blocks(basket.id()).isEmpty());

        // 2. Rejected is terminal
        assertThrows(InvalidStateException.class,
            () -> proposals.approve(basket.id(), first.id(), "reviewer-2", null));

        // 3. Revised suggestion is approved
        Proposal second = proposals.create(agentProposal(basket, workspace, "Hire 2 people this quarter"));
        ApprovalResult approval = proposals.approve(basket.id(), second.id(), "reviewer-1", null);
        assertEquals(1, approval.operationsExecuted());
        assertEquals("Hire 2 people this quarter", substrate.blocks(basket.id()).get(0).content());

        // 4. Executed proposals can never be rejected
        ConflictException ex = assertThrows(ConflictException.class,
            () -> proposals.reject(basket.id(), second.id(), "reviewer-2", "second thoughts"));
        assertTrue(ex.getMessage().contains("Cannot reject executed proposal"));

        // 5. Timeline: rejection recorded with its reason, agent origin on creation
        List<TimelineEvent> events = timeline.list(basket.id(), TimelineQuery.firstPage(50)).events();
        TimelineEvent rejection = events.stream()
            .filter(e -> TimelineKinds.PROPOSAL_REJECTED.equals(e.kind()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("No rejection event"));
        assertEquals("unrealistic timeline", rejection.payload().get("reason"));
        assertEquals(first.id(), rejection.refId());
        assertEquals(1, events.stream().filter(e -> TimelineKinds.PROPOSAL_REJECTED.equals(e.kind())).count());
        assertEquals("agent", events.get(0).origin().getValue());
    }

    private static NewProposal agentProposal(Basket basket, String workspace, String content) {
        return new NewProposal(basket.id(), workspace, ProposalKind.EXTRACTION, ProposalOrigin.AGENT,
            List.of(Operation.of(OperationType.CREATE_BLOCK, Map.of("content", content))),
            null, 0.65, null, List.of(), EntryPoint.REFLECTION_SUGGESTION, "agent-7");
    }
}
