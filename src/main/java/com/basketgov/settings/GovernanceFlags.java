package com.basketgov.settings;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective governance configuration for one workspace. Built once per
 * request by {@link GovernanceSettingsResolver} and threaded through every
 * component call; never read ad hoc from the process environment.
 */
public record GovernanceFlags(
    @JsonProperty("governance_enabled") boolean governanceEnabled,
    @JsonProperty("validator_required") boolean validatorRequired,
    @JsonProperty("direct_substrate_writes") boolean directSubstrateWrites,
    @JsonProperty("governance_ui_enabled") boolean governanceUiEnabled,
    @JsonProperty("cascade_events_enabled") boolean cascadeEventsEnabled,
    @JsonIgnore Map<EntryPoint, Policy> entryPointPolicies,
    @JsonProperty("default_blast_radius") BlastRadius defaultBlastRadius
) {

    public static final boolean DEFAULT_GOVERNANCE_ENABLED = false;
    public static final boolean DEFAULT_VALIDATOR_REQUIRED = false;
    public static final boolean DEFAULT_DIRECT_SUBSTRATE_WRITES = true;
    public static final boolean DEFAULT_GOVERNANCE_UI_ENABLED = false;
    public static final boolean DEFAULT_CASCADE_EVENTS_ENABLED = true;
    public static final Policy DEFAULT_POLICY = Policy.PROPOSAL;
    public static final BlastRadius DEFAULT_BLAST_RADIUS = BlastRadius.SCOPED;

    public GovernanceFlags {
        EnumMap<EntryPoint, Policy> complete = new EnumMap<>(EntryPoint.class);
        for (EntryPoint ep : EntryPoint.values()) {
            Policy policy = entryPointPolicies != null ? entryPointPolicies.get(ep) : null;
            complete.put(ep, policy != null ? policy : DEFAULT_POLICY);
        }
        entryPointPolicies = Collections.unmodifiableMap(complete);
        defaultBlastRadius = defaultBlastRadius != null ? defaultBlastRadius : DEFAULT_BLAST_RADIUS;
    }

    /** Hardcoded defaults: the bottom of the precedence chain. */
    public static GovernanceFlags defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Policy policyFor(EntryPoint entryPoint) {
        Policy policy = entryPointPolicies.get(entryPoint);
        return policy != null ? policy : DEFAULT_POLICY;
    }

    @JsonProperty("entry_point_policies")
    public Map<String, String> entryPointPolicyView() {
        Map<String, String> view = new LinkedHashMap<>();
        entryPointPolicies.forEach((ep, policy) -> view.put(ep.getValue(), policy.getValue()));
        return view;
    }

    public static final class Builder {
        private boolean governanceEnabled = DEFAULT_GOVERNANCE_ENABLED;
        private boolean validatorRequired = DEFAULT_VALIDATOR_REQUIRED;
        private boolean directSubstrateWrites = DEFAULT_DIRECT_SUBSTRATE_WRITES;
        private boolean governanceUiEnabled = DEFAULT_GOVERNANCE_UI_ENABLED;
        private boolean cascadeEventsEnabled = DEFAULT_CASCADE_EVENTS_ENABLED;
        private final EnumMap<EntryPoint, Policy> entryPointPolicies = new EnumMap<>(EntryPoint.class);
        private BlastRadius defaultBlastRadius = DEFAULT_BLAST_RADIUS;

        private Builder() {
        }

        public Builder governanceEnabled(boolean value) {
            this.governanceEnabled = value;
            return this;
        }

        public Builder validatorRequired(boolean value) {
            this.validatorRequired = value;
            return this;
        }

        public Builder directSubstrateWrites(boolean value) {
            this.directSubstrateWrites = value;
            return this;
        }

        public Builder governanceUiEnabled(boolean value) {
            this.governanceUiEnabled = value;
            return this;
        }

        public Builder cascadeEventsEnabled(boolean value) {
            this.cascadeEventsEnabled = value;
            return this;
        }

        public Builder entryPointPolicy(EntryPoint entryPoint, Policy policy) {
            this.entryPointPolicies.put(entryPoint, policy);
            return this;
        }

        public Builder entryPointPolicies(Map<EntryPoint, Policy> policies) {
            this.entryPointPolicies.putAll(policies);
            return this;
        }

        public Builder defaultBlastRadius(BlastRadius value) {
            this.defaultBlastRadius = value;
            return this;
        }

        public GovernanceFlags build() {
            return new GovernanceFlags(governanceEnabled, validatorRequired, directSubstrateWrites,
                governanceUiEnabled, cascadeEventsEnabled, entryPointPolicies, defaultBlastRadius);
        }
    }
}
