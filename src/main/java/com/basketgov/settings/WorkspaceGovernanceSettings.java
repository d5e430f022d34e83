package com.basketgov.settings;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stored per-workspace governance row. A {@code null} field (or an entry
 * point missing from the policy map) means "not set here", so resolution
 * falls through to the environment value.
 */
public record WorkspaceGovernanceSettings(
    String workspaceId,
    Boolean governanceEnabled,
    Boolean validatorRequired,
    Boolean directSubstrateWrites,
    Boolean governanceUiEnabled,
    Boolean cascadeEventsEnabled,
    Map<EntryPoint, Policy> entryPointPolicies,
    BlastRadius defaultBlastRadius,
    Instant updatedAt,
    String updatedBy
) {

    public WorkspaceGovernanceSettings {
        EnumMap<EntryPoint, Policy> copy = new EnumMap<>(EntryPoint.class);
        if (entryPointPolicies != null) {
            copy.putAll(entryPointPolicies);
        }
        entryPointPolicies = Collections.unmodifiableMap(copy);
    }

    public static WorkspaceGovernanceSettings empty(String workspaceId) {
        return new WorkspaceGovernanceSettings(workspaceId, null, null, null, null, null,
            Map.of(), null, null, null);
    }

    /**
     * Overlays every non-null field of {@code patch} onto this row.
     */
    public WorkspaceGovernanceSettings merge(WorkspaceGovernanceSettings patch, Instant at, String actorId) {
        EnumMap<EntryPoint, Policy> policies = new EnumMap<>(EntryPoint.class);
        policies.putAll(entryPointPolicies);
        policies.putAll(patch.entryPointPolicies());
        return new WorkspaceGovernanceSettings(
            workspaceId,
            patch.governanceEnabled() != null ? patch.governanceEnabled() : governanceEnabled,
            patch.validatorRequired() != null ? patch.validatorRequired() : validatorRequired,
            patch.directSubstrateWrites() != null ? patch.directSubstrateWrites() : directSubstrateWrites,
            patch.governanceUiEnabled() != null ? patch.governanceUiEnabled() : governanceUiEnabled,
            patch.cascadeEventsEnabled() != null ? patch.cascadeEventsEnabled() : cascadeEventsEnabled,
            policies,
            patch.defaultBlastRadius() != null ? patch.defaultBlastRadius() : defaultBlastRadius,
            at,
            actorId
        );
    }
}
