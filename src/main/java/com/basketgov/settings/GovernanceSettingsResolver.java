package com.basketgov.settings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Optional;

/**
 * Merges the stored workspace row over environment defaults, field by field.
 * Never fails: an unreadable row degrades to the environment layer.
 */
public class GovernanceSettingsResolver {

    private static final Logger log = LoggerFactory.getLogger(GovernanceSettingsResolver.class);

    private final WorkspaceSettingsStore store;
    private final EnvironmentDefaults environment;

    public GovernanceSettingsResolver(WorkspaceSettingsStore store, EnvironmentDefaults environment) {
        this.store = store;
        this.environment = environment;
    }

    public GovernanceFlags resolve(String workspaceId) {
        return resolveWithSource(workspaceId).settings();
    }

    public ResolvedSettings resolveWithSource(String workspaceId) {
        GovernanceFlags env = environment.flags();
        Optional<WorkspaceGovernanceSettings> row = readRow(workspaceId);
        if (row.isEmpty()) {
            return new ResolvedSettings(env, SettingsSource.ENVIRONMENT_DEFAULTS);
        }
        return new ResolvedSettings(overlay(row.get(), env), SettingsSource.WORKSPACE_DATABASE);
    }

    private Optional<WorkspaceGovernanceSettings> readRow(String workspaceId) {
        if (workspaceId == null) {
            return Optional.empty();
        }
        try {
            return store.find(workspaceId);
        } catch (RuntimeException ex) {
            log.warn("Workspace settings unreadable for workspace={}, using environment defaults: {}",
                workspaceId, ex.getMessage());
            return Optional.empty();
        }
    }

    static GovernanceFlags overlay(WorkspaceGovernanceSettings row, GovernanceFlags env) {
        EnumMap<EntryPoint, Policy> policies = new EnumMap<>(env.entryPointPolicies());
        policies.putAll(row.entryPointPolicies());
        return GovernanceFlags.builder()
            .governanceEnabled(pick(row.governanceEnabled(), env.governanceEnabled()))
            .validatorRequired(pick(row.validatorRequired(), env.validatorRequired()))
            .directSubstrateWrites(pick(row.directSubstrateWrites(), env.directSubstrateWrites()))
            .governanceUiEnabled(pick(row.governanceUiEnabled(), env.governanceUiEnabled()))
            .cascadeEventsEnabled(pick(row.cascadeEventsEnabled(), env.cascadeEventsEnabled()))
            .entryPointPolicies(policies)
            .defaultBlastRadius(row.defaultBlastRadius() != null ? row.defaultBlastRadius() : env.defaultBlastRadius())
            .build();
    }

    private static boolean pick(Boolean stored, boolean fallback) {
        return stored != null ? stored : fallback;
    }
}
