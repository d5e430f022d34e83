package com.basketgov.settings;

import java.util.Optional;
import java.util.function.UnaryOperator;

public interface WorkspaceSettingsStore {

    Optional<WorkspaceGovernanceSettings> find(String workspaceId);

    WorkspaceGovernanceSettings save(WorkspaceGovernanceSettings settings);

    /**
     * Atomically replaces the workspace row with {@code change} applied to
     * the current row, or to an empty row when none is stored yet.
     * Concurrent merges on one workspace never lose each other's fields.
     */
    WorkspaceGovernanceSettings merge(String workspaceId, UnaryOperator<WorkspaceGovernanceSettings> change);
}
