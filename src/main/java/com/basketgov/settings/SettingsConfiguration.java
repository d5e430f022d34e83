package com.basketgov.settings;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

@Configuration
public class SettingsConfiguration {

    /**
     * Environment defaults come from Spring's {@link Environment}, which
     * exposes OS environment variables alongside application properties.
     */
    @Bean
    public EnvironmentDefaults environmentDefaults(Environment environment) {
        return new EnvironmentDefaults(environment::getProperty);
    }

    @Bean
    public GovernanceSettingsResolver governanceSettingsResolver(WorkspaceSettingsStore store,
                                                                 EnvironmentDefaults environmentDefaults) {
        return new GovernanceSettingsResolver(store, environmentDefaults);
    }

    @Bean
    public GovernanceSettingsService governanceSettingsService(GovernanceSettingsResolver resolver,
                                                               WorkspaceSettingsStore store,
                                                               Clock clock) {
        return new GovernanceSettingsService(resolver, store, clock);
    }
}
