package com.basketgov.settings;

import java.util.function.Function;

/**
 * Environment-derived governance defaults, the middle layer of the
 * precedence chain. Values are looked up through an injected function so
 * that the process environment is never read ad hoc.
 *
 * Boolean inputs are parsed strictly: for fields defaulting to {@code false}
 * only the literal {@code "true"} enables them; for fields defaulting to
 * {@code true} only the literal {@code "false"} disables them.
 */
public class EnvironmentDefaults {

    public static final String GOVERNANCE_ENABLED = "GOVERNANCE_ENABLED";
    public static final String VALIDATOR_REQUIRED = "VALIDATOR_REQUIRED";
    public static final String DIRECT_SUBSTRATE_WRITES = "DIRECT_SUBSTRATE_WRITES";
    public static final String GOVERNANCE_UI_ENABLED = "GOVERNANCE_UI_ENABLED";
    public static final String CASCADE_EVENTS_ENABLED = "CASCADE_EVENTS_ENABLED";
    public static final String DEFAULT_BLAST_RADIUS = "DEFAULT_BLAST_RADIUS";

    private final Function<String, String> lookup;

    public EnvironmentDefaults(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    public static EnvironmentDefaults none() {
        return new EnvironmentDefaults(key -> null);
    }

    public static boolean parseBoolean(String raw) {
        return "true".equals(raw);
    }

    public static boolean parseDefaultTrueBoolean(String raw) {
        return !"false".equals(raw);
    }

    public GovernanceFlags flags() {
        GovernanceFlags.Builder builder = GovernanceFlags.builder()
            .governanceEnabled(parseBoolean(lookup.apply(GOVERNANCE_ENABLED)))
            .validatorRequired(parseBoolean(lookup.apply(VALIDATOR_REQUIRED)))
            .directSubstrateWrites(parseDefaultTrueBoolean(lookup.apply(DIRECT_SUBSTRATE_WRITES)))
            .governanceUiEnabled(parseBoolean(lookup.apply(GOVERNANCE_UI_ENABLED)))
            .cascadeEventsEnabled(parseDefaultTrueBoolean(lookup.apply(CASCADE_EVENTS_ENABLED)));

        for (EntryPoint ep : EntryPoint.values()) {
            Policy.parse(lookup.apply(ep.environmentKey()))
                .ifPresent(policy -> builder.entryPointPolicy(ep, policy));
        }
        BlastRadius.parse(lookup.apply(DEFAULT_BLAST_RADIUS)).ifPresent(builder::defaultBlastRadius);
        return builder.build();
    }
}
