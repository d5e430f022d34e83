package com.basketgov.settings;

import com.basketgov.error.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read and admin-write access to workspace governance settings.
 */
public class GovernanceSettingsService {

    private static final Logger log = LoggerFactory.getLogger(GovernanceSettingsService.class);

    private final GovernanceSettingsResolver resolver;
    private final WorkspaceSettingsStore store;
    private final Clock clock;

    public GovernanceSettingsService(GovernanceSettingsResolver resolver, WorkspaceSettingsStore store, Clock clock) {
        this.resolver = resolver;
        this.store = store;
        this.clock = clock;
    }

    public ResolvedSettings current(String workspaceId) {
        return resolver.resolveWithSource(workspaceId);
    }

    public GovernanceStatus status(String workspaceId) {
        return GovernanceStatus.of(workspaceId, resolver.resolve(workspaceId));
    }

    /**
     * Validates a partial settings document, merges it onto the stored row
     * and persists the result. Any invalid value rejects the whole update.
     */
    public ResolvedSettings update(String workspaceId, Map<String, Object> body, String actorId) {
        if (body == null) {
            throw new InvalidRequestException("settings body is required");
        }
        WorkspaceGovernanceSettings patch = parsePatch(workspaceId, body);
        store.merge(workspaceId, existing -> existing.merge(patch, clock.instant(), actorId));
        log.info("Governance settings updated for workspace={} by actor={} fields={}",
            workspaceId, actorId, body.keySet());
        return resolver.resolveWithSource(workspaceId);
    }

    private WorkspaceGovernanceSettings parsePatch(String workspaceId, Map<String, Object> body) {
        EnumMap<EntryPoint, Policy> policies = new EnumMap<>(EntryPoint.class);
        Object rawPolicies = body.get("entry_point_policies");
        if (rawPolicies != null) {
            if (!(rawPolicies instanceof Map<?, ?> map)) {
                throw new InvalidRequestException("entry_point_policies must be an object");
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                EntryPoint ep = EntryPoint.parse(key)
                    .orElseThrow(() -> new InvalidRequestException("Unknown entry point: " + key));
                String value = entry.getValue() instanceof String s ? s : null;
                Policy policy = Policy.parse(value)
                    .orElseThrow(() -> new InvalidRequestException(
                        "Invalid policy for " + key + ": " + entry.getValue()
                            + " (expected proposal, direct or hybrid)"));
                policies.put(ep, policy);
            }
        }

        BlastRadius blastRadius = null;
        Object rawRadius = body.get("default_blast_radius");
        if (rawRadius != null) {
            String value = rawRadius instanceof String s ? s : null;
            blastRadius = BlastRadius.parse(value)
                .orElseThrow(() -> new InvalidRequestException(
                    "Invalid default_blast_radius: " + rawRadius + " (expected Local, Scoped or Global)"));
        }

        return new WorkspaceGovernanceSettings(
            workspaceId,
            optionalBoolean(body, "governance_enabled"),
            optionalBoolean(body, "validator_required"),
            optionalBoolean(body, "direct_substrate_writes"),
            optionalBoolean(body, "governance_ui_enabled"),
            optionalBoolean(body, "cascade_events_enabled"),
            policies,
            blastRadius,
            null,
            null
        );
    }

    private Boolean optionalBoolean(Map<String, Object> body, String field) {
        Object value = body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Boolean flag)) {
            throw new InvalidRequestException(field + " must be a boolean");
        }
        return flag;
    }
}
