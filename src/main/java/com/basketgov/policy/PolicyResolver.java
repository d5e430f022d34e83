package com.basketgov.policy;

import com.basketgov.settings.BlastRadius;
import com.basketgov.settings.EntryPoint;
import com.basketgov.settings.GovernanceFlags;
import com.basketgov.settings.Policy;

/**
 * Deterministic router: decides whether a change applies directly or goes
 * through review. Pure function of its arguments; never throws, malformed
 * hints resolve toward {@link ExecutionMode#PROPOSAL}.
 */
public class PolicyResolver {

    public static final double AUTO_EXECUTE_CONFIDENCE = 0.8;
    public static final String ALLOW_AUTO = "allow_auto";

    public ExecutionMode route(EntryPoint entryPoint, GovernanceFlags flags,
                               Double confidence, String userOverride) {
        return decide(entryPoint, flags, confidence, userOverride, null, null).mode();
    }

    public RoutingDecision decide(EntryPoint entryPoint,
                                  GovernanceFlags flags,
                                  Double confidence,
                                  String userOverride,
                                  ValidatorReport validatorReport,
                                  BlastRadius declaredBlastRadius) {
        GovernanceFlags effective = flags != null ? flags : GovernanceFlags.defaults();
        BlastRadius blastRadius = declaredBlastRadius != null
            ? declaredBlastRadius
            : effective.defaultBlastRadius();

        if (!effective.governanceEnabled()) {
            return new RoutingDecision(ExecutionMode.DIRECT, "governance_disabled", blastRadius);
        }
        if (entryPoint == null) {
            return new RoutingDecision(ExecutionMode.PROPOSAL, "entry_point_unknown:fallback_proposal", blastRadius);
        }

        String ep = entryPoint.getValue();
        Policy policy = effective.policyFor(entryPoint);
        RoutingDecision byPolicy = switch (policy) {
            case DIRECT -> new RoutingDecision(ExecutionMode.DIRECT, "ep_policy_direct:" + ep, blastRadius);
            case PROPOSAL -> new RoutingDecision(ExecutionMode.PROPOSAL, "ep_policy_proposal:" + ep, blastRadius);
            case HYBRID -> hybrid(ep, confidence, userOverride, blastRadius);
        };
        ExecutionMode mode = byPolicy.mode();
        String reason = byPolicy.reason();

        // raw capture stays direct even when direct writes are switched off
        if (mode == ExecutionMode.DIRECT
                && !effective.directSubstrateWrites()
                && entryPoint != EntryPoint.ONBOARDING_DUMP) {
            mode = ExecutionMode.PROPOSAL;
            reason += ":forced_proposal_no_direct_writes";
        }

        if (mode == ExecutionMode.DIRECT && effective.validatorRequired() && !validatorCleared(validatorReport)) {
            mode = ExecutionMode.PROPOSAL;
            reason += ":validator_required";
        }

        return new RoutingDecision(mode, reason, blastRadius);
    }

    private static RoutingDecision hybrid(String ep, Double confidence, String userOverride,
                                          BlastRadius blastRadius) {
        Double score = sanitize(confidence);
        if (score == null) {
            return new RoutingDecision(ExecutionMode.PROPOSAL, "ep_policy_hybrid:" + ep + ":no_confidence", blastRadius);
        }
        if (score < AUTO_EXECUTE_CONFIDENCE) {
            return new RoutingDecision(ExecutionMode.PROPOSAL, "ep_policy_hybrid:" + ep + ":low_confidence", blastRadius);
        }
        if (!ALLOW_AUTO.equals(userOverride)) {
            return new RoutingDecision(ExecutionMode.PROPOSAL, "ep_policy_hybrid:" + ep + ":auto_not_allowed",
                blastRadius);
        }
        return new RoutingDecision(ExecutionMode.DIRECT, "ep_policy_hybrid:" + ep + ":high_confidence", blastRadius);
    }

    private static boolean validatorCleared(ValidatorReport report) {
        return report != null && report.isWellFormed() && report.confidence() >= AUTO_EXECUTE_CONFIDENCE;
    }

    private static Double sanitize(Double confidence) {
        if (confidence == null || !Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
            return null;
        }
        return confidence;
    }
}
