package com.basketgov.settings;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryWorkspaceSettingsStore implements WorkspaceSettingsStore {

    private final ConcurrentHashMap<String, WorkspaceGovernanceSettings> rows = new ConcurrentHashMap<>();

    @Override
    public Optional<WorkspaceGovernanceSettings> find(String workspaceId) {
        return Optional.ofNullable(rows.get(workspaceId));
    }

    @Override
    public WorkspaceGovernanceSettings save(WorkspaceGovernanceSettings settings) {
        rows.put(settings.workspaceId(), settings);
        return settings;
    }

    @Override
    public WorkspaceGovernanceSettings merge(String workspaceId, UnaryOperator<WorkspaceGovernanceSettings> change) {
        return rows.compute(workspaceId, (id, current) ->
            change.apply(current != null ? current : WorkspaceGovernanceSettings.empty(id)));
    }
}
