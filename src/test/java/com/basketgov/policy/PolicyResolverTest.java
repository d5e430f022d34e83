package com.basketgov.policy;

import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;
import com.basketgov.settings.GovernanceFlags;
import com.basketgov.settings.Policy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyResolverTest {

    private final PolicyResolver resolver = new PolicyResolver();

    @Nested
    @DisplayName("Governance disabled")
    class Disabled {

        @ParameterizedTest
        @EnumSource(EntryPoint.class)
        void everyEntryPointIsDirect(EntryPoint ep) {
            GovernanceFlags flags = GovernanceFlags.builder()
                .governanceEnabled(false)
                .entryPointPolicy(ep, Policy.PROPOSAL)
                .validatorRequired(true)
                .build();
            RoutingDecision decision = resolver.decide(ep, flags, null, null, null, null);
            assertEquals(ExecutionMode.DIRECT, decision.mode());
            assertEquals("governance_disabled", decision.reason());
        }
    }

    @Nested
    @DisplayName("Entry point policies")
    class EntryPointPolicies {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, 0.5, 0.8, 0.99, 1.0})
        void proposalPolicyIgnoresConfidence(double confidence) {
            GovernanceFlags flags = enabled().entryPointPolicy(EntryPoint.MANUAL_EDIT, Policy.PROPOSAL).build();
            assertEquals(ExecutionMode.PROPOSAL,
                resolver.route(EntryPoint.MANUAL_EDIT, flags, confidence, PolicyResolver.ALLOW_AUTO));
        }

        @Test
        void directPolicyRoutesDirect() {
            GovernanceFlags flags = enabled().entryPointPolicy(EntryPoint.GRAPH_ACTION, Policy.DIRECT).build();
            RoutingDecision decision = resolver.decide(EntryPoint.GRAPH_ACTION, flags, null, null, null, null);
            assertEquals(ExecutionMode.DIRECT, decision.mode());
            assertEquals("ep_policy_direct:graph_action", decision.reason());
        }

        @Test
        void unsetEntryPointDefaultsToProposal() {
            GovernanceFlags flags = enabled().build();
            assertEquals(ExecutionMode.PROPOSAL, resolver.route(EntryPoint.TIMELINE_RESTORE, flags, 1.0,
                PolicyResolver.ALLOW_AUTO));
        }

        @Test
        void unknownEntryPointFallsBackToProposal() {
            assertEquals(ExecutionMode.PROPOSAL, resolver.route(null, enabled().build(), 1.0, null));
        }
    }

    @Nested
    @DisplayName("Hybrid policy")
    class Hybrid {

        private final GovernanceFlags flags = enabled()
            .entryPointPolicy(EntryPoint.REFLECTION_SUGGESTION, Policy.HYBRID)
            .build();

        @Test
        void highConfidenceWithOverrideIsDirect() {
            RoutingDecision decision = resolver.decide(EntryPoint.REFLECTION_SUGGESTION, flags, 0.8,
                PolicyResolver.ALLOW_AUTO, null, null);
            assertEquals(ExecutionMode.DIRECT, decision.mode());
            assertEquals("ep_policy_hybrid:reflection_suggestion:high_confidence", decision.reason());
        }

        @Test
        void highConfidenceWithoutOverrideIsProposal() {
            RoutingDecision decision = resolver.decide(EntryPoint.REFLECTION_SUGGESTION, flags, 0.95, null, null, null);
            assertEquals(ExecutionMode.PROPOSAL, decision.mode());
            assertTrue(decision.reason().endsWith("auto_not_allowed"));
        }

        @Test
        void lowConfidenceIsProposal() {
            RoutingDecision decision = resolver.decide(EntryPoint.REFLECTION_SUGGESTION, flags, 0.79,
                PolicyResolver.ALLOW_AUTO, null, null);
            assertEquals(ExecutionMode.PROPOSAL, decision.mode());
            assertTrue(decision.reason().endsWith("low_confidence"));
        }

        @Test
        void missingConfidenceIsProposal() {
            assertEquals(ExecutionMode.PROPOSAL,
                resolver.route(EntryPoint.REFLECTION_SUGGESTION, flags, null, PolicyResolver.ALLOW_AUTO));
        }

        @ParameterizedTest
        @ValueSource(doubles = {Double.NaN, 1.5, -0.2, Double.POSITIVE_INFINITY})
        void outOfRangeConfidenceIsTreatedAsMissing(double confidence) {
            assertEquals(ExecutionMode.PROPOSAL,
                resolver.route(EntryPoint.REFLECTION_SUGGESTION, flags, confidence, PolicyResolver.ALLOW_AUTO));
        }
    }

    @Nested
    @DisplayName("Forcing rules")
    class Forcing {

        @Test
        void directWritesOffForcesProposal() {
            GovernanceFlags flags = enabled()
                .directSubstrateWrites(false)
                .entryPointPolicy(EntryPoint.MANUAL_EDIT, Policy.DIRECT)
                .build();
            RoutingDecision decision = resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, null, null);
            assertEquals(ExecutionMode.PROPOSAL, decision.mode());
            assertEquals("ep_policy_direct:manual_edit:forced_proposal_no_direct_writes", decision.reason());
        }

        @Test
        void onboardingDumpStaysDirectWithoutDirectWrites() {
            GovernanceFlags flags = enabled()
                .directSubstrateWrites(false)
                .entryPointPolicy(EntryPoint.ONBOARDING_DUMP, Policy.DIRECT)
                .build();
            assertEquals(ExecutionMode.DIRECT, resolver.route(EntryPoint.ONBOARDING_DUMP, flags, null, null));
        }

        @Test
        void validatorRequiredWithoutReportForcesProposal() {
            GovernanceFlags flags = enabled()
                .validatorRequired(true)
                .entryPointPolicy(EntryPoint.MANUAL_EDIT, Policy.DIRECT)
                .build();
            RoutingDecision decision = resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, null, null);
            assertEquals(ExecutionMode.PROPOSAL, decision.mode());
            assertTrue(decision.reason().endsWith(":validator_required"));
        }

        @Test
        void validatorRequiredWithConfidentReportStaysDirect() {
            GovernanceFlags flags = enabled()
                .validatorRequired(true)
                .entryPointPolicy(EntryPoint.MANUAL_EDIT, Policy.DIRECT)
                .build();
            ValidatorReport report = new ValidatorReport(0.85, "adds one block", List.of());
            assertEquals(ExecutionMode.DIRECT,
                resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, report, null).mode());
        }

        @Test
        void validatorRequiredWithWeakReportForcesProposal() {
            GovernanceFlags flags = enabled()
                .validatorRequired(true)
                .entryPointPolicy(EntryPoint.MANUAL_EDIT, Policy.DIRECT)
                .build();
            ValidatorReport report = new ValidatorReport(0.6, "touches many items", List.of("broad change"));
            assertEquals(ExecutionMode.PROPOSAL,
                resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, report, null).mode());
        }
    }

    @Test
    @DisplayName("Blast radius: explicit value wins, else workspace default")
    void effectiveBlastRadius() {
        GovernanceFlags flags = enabled().defaultBlastRadius(BlastRadius.GLOBAL).build();
        assertEquals(BlastRadius.GLOBAL,
            resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, null, null).effectiveBlastRadius());
        assertEquals(BlastRadius.LOCAL,
            resolver.decide(EntryPoint.MANUAL_EDIT, flags, null, null, null, BlastRadius.LOCAL).effectiveBlastRadius());
    }

    @Test
    @DisplayName("Routing is deterministic for identical inputs")
    void deterministic() {
        GovernanceFlags flags = enabled().entryPointPolicy(EntryPoint.DOCUMENT_EDIT, Policy.HYBRID).build();
        RoutingDecision first = resolver.decide(EntryPoint.DOCUMENT_EDIT, flags, 0.9, PolicyResolver.ALLOW_AUTO, null, null);
        for (int i = 0; i < 50; i++) {
            assertEquals(first,
                resolver.decide(EntryPoint.DOCUMENT_EDIT, flags, 0.9, PolicyResolver.ALLOW_AUTO, null, null));
        }
    }

    @Test
    @DisplayName("Null flags behave like hardcoded defaults")
    void nullFlags() {
        assertEquals(ExecutionMode.DIRECT, resolver.route(EntryPoint.MANUAL_EDIT, null, null, null));
    }

    @ParameterizedTest
    @EnumSource(Policy.class)
    @DisplayName("Every policy routes every entry point without throwing")
    void everyPolicyRoutes(Policy policy) {
        Double[] confidences = {null, Double.NaN, -1.0, 0.0, 0.8, 1.0, 7.0};
        String[] overrides = {null, "", PolicyResolver.ALLOW_AUTO, "deny"};
        for (EntryPoint ep : EntryPoint.values()) {
            GovernanceFlags flags = enabled().entryPointPolicy(ep, policy).build();
            for (Double confidence : confidences) {
                for (String override : overrides) {
                    RoutingDecision decision = assertDoesNotThrow(
                        () -> resolver.decide(ep, flags, confidence, override, null, null));
                    assertNotNull(decision.mode());
                    assertTrue(decision.reason().contains(ep.getValue()), decision.reason());
                }
            }
        }
    }

    private static GovernanceFlags.Builder enabled() {
        return GovernanceFlags.builder().governanceEnabled(true);
    }
}
