package com.basketgov.work;

import com.basketgov.GovernanceProperties;
import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationContractValidator;
import com.basketgov.contract.OperationType;
import com.basketgov.execution.ExecutionEngine;
import com.basketgov.execution.SubstrateOperationHandlers;
import com.basketgov.policy.ExecutionMode;
import com.basketgov.policy.PolicyResolver;
import com.basketgov.policy.ValidatorClient;
import com.basketgov.policy.ValidatorGateway;
import com.basketgov.policy.ValidatorReport;
import com.basketgov.proposal.InMemoryProposalStore;
import com.basketgov.proposal.Proposal;
import com.basketgov.proposal.ProposalKind;
import com.basketgov.proposal.ProposalOrigin;
import com.basketgov.proposal.ProposalService;
import com.basketgov.proposal.ProposalStatus;
import com.basketgov.settings.EntryPoint;
import com.basketgov.settings.EnvironmentDefaults;
import com.basketgov.settings.GovernanceSettingsResolver;
import com.basketgov.settings.InMemoryWorkspaceSettingsStore;
import com.basketgov.settings.Policy;
import com.basketgov.settings.WorkspaceGovernanceSettings;
import com.basketgov.substrate.InMemorySubstrateStore;
import com.basketgov.timeline.InMemoryTimelineStore;
import com.basketgov.timeline.TimelineEmitter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class WorkServiceTest {

    private static final String BASKET = "basket-1";
    private static final String WORKSPACE = "ws-1";

    private ExecutorService executor;
    private InMemoryWorkspaceSettingsStore settingsStore;
    private InMemorySubstrateStore substrate;
    private ProposalService proposalService;
    private GovernanceSettingsResolver resolver;
    private OperationContractValidator validator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        executor = Executors.newCachedThreadPool();
        settingsStore = new InMemoryWorkspaceSettingsStore();
        substrate = new InMemorySubstrateStore();
        validator = new OperationContractValidator();
        TimelineEmitter timeline = new TimelineEmitter(new InMemoryTimelineStore(clock), new GovernanceProperties());
        resolver = new GovernanceSettingsResolver(settingsStore, EnvironmentDefaults.none());
        ExecutionEngine engine = new ExecutionEngine(substrate, new SubstrateOperationHandlers(clock), validator,
            timeline);
        proposalService = new ProposalService(new InMemoryProposalStore(), engine, validator, timeline, resolver, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Governance off: applied directly and audited as auto-approved")
    void governanceDisabledAppliesDirectly() {
        WorkOutcome outcome = workService(Optional.empty()).submit(request(EntryPoint.MANUAL_EDIT, null, null));

        assertEquals(ExecutionMode.DIRECT, outcome.mode());
        assertEquals("governance_disabled", outcome.reason());
        assertEquals(ProposalStatus.APPROVED, outcome.status());
        assertEquals(1, outcome.operationsExecuted());
        assertEquals("skipped", outcome.validator());
        Proposal audit = proposalService.get(BASKET, outcome.proposalId());
        assertTrue(audit.autoApproved());
        assertEquals(1, substrate.blocks(BASKET).size());
    }

    @Test
    @DisplayName("Proposal policy parks the change for review")
    void proposalPolicyCreatesPendingProposal() {
        enableGovernance(Map.of(EntryPoint.MANUAL_EDIT, Policy.PROPOSAL), false);

        WorkOutcome outcome = workService(Optional.empty()).submit(request(EntryPoint.MANUAL_EDIT, 0.99, "allow_auto"));

        assertEquals(ExecutionMode.PROPOSAL, outcome.mode());
        assertEquals(ProposalStatus.PROPOSED, outcome.status());
        assertNull(outcome.commitId());
        assertTrue(substrate.blocks(BASKET).isEmpty());
    }

    @Test
    @DisplayName("Hybrid policy with confident override executes")
    void hybridHighConfidence() {
        enableGovernance(Map.of(EntryPoint.REFLECTION_SUGGESTION, Policy.HYBRID), false);

        WorkOutcome outcome = workService(Optional.empty())
            .submit(request(EntryPoint.REFLECTION_SUGGESTION, 0.9, "allow_auto"));

        assertEquals(ExecutionMode.DIRECT, outcome.mode());
        assertNotNull(outcome.commitId());
    }

    @Test
    @DisplayName("Validator required and unavailable: fails closed to proposal")
    void validatorUnavailableFailsClosed() {
        enableGovernance(Map.of(EntryPoint.GRAPH_ACTION, Policy.DIRECT), true);
        ValidatorClient broken = request -> {
            throw new IllegalStateException("agent offline");
        };

        WorkOutcome outcome = workService(Optional.of(broken)).submit(request(EntryPoint.GRAPH_ACTION, null, null));

        assertEquals(ExecutionMode.PROPOSAL, outcome.mode());
        assertTrue(outcome.reason().endsWith(":validator_required"));
        assertEquals("unavailable", outcome.validator());
        assertNull(proposalService.get(BASKET, outcome.proposalId()).validatorReport());
    }

    @Test
    @DisplayName("Validator required and confident: direct policy executes with report attached")
    void validatorConfidentAllowsDirect() {
        enableGovernance(Map.of(EntryPoint.GRAPH_ACTION, Policy.DIRECT), true);
        ValidatorReport report = new ValidatorReport(0.92, "adds one block", List.of());

        WorkOutcome outcome = workService(Optional.of(request -> report))
            .submit(request(EntryPoint.GRAPH_ACTION, null, null));

        assertEquals(ExecutionMode.DIRECT, outcome.mode());
        Proposal audit = proposalService.get(BASKET, outcome.proposalId());
        assertEquals(report, audit.validatorReport());
        assertEquals(0.92, audit.confidence());
    }

    private void enableGovernance(Map<EntryPoint, Policy> policies, boolean validatorRequired) {
        settingsStore.save(new WorkspaceGovernanceSettings(WORKSPACE, true, validatorRequired, null, null, null,
            policies, null, null, null));
    }

    private WorkService workService(Optional<ValidatorClient> client) {
        ValidatorGateway gateway = new ValidatorGateway(client, Duration.ofSeconds(1), executor);
        return new WorkService(resolver, new PolicyResolver(), gateway, proposalService, validator);
    }

    private static WorkRequest request(EntryPoint entryPoint, Double confidence, String override) {
        return new WorkRequest(BASKET, WORKSPACE, "user-1", entryPoint,
            List.of(Operation.of(OperationType.CREATE_BLOCK, Map.of("content", "from " + entryPoint.getValue()))),
            ProposalKind.EDIT, ProposalOrigin.HUMAN, confidence, override, null, List.of());
    }
}
