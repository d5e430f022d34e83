package com.basketgov.policy;

import com.basketgov.GovernanceProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class PolicyConfiguration {

    @Bean
    public PolicyResolver policyResolver() {
        return new PolicyResolver();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService validatorExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "validator-call");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * The validator agent is optional; without a {@link ValidatorClient}
     * bean every validation resolves to unavailable.
     */
    @Bean
    public ValidatorGateway validatorGateway(Optional<ValidatorClient> validatorClient,
                                             GovernanceProperties properties,
                                             @Qualifier("validatorExecutor") ExecutorService validatorExecutor) {
        return new ValidatorGateway(validatorClient, properties.getValidatorTimeout(), validatorExecutor);
    }
}
