package com.basketgov.work;

import com.basketgov.contract.OperationContractValidator;
import com.basketgov.policy.PolicyResolver;
import com.basketgov.policy.ValidatorGateway;
import com.basketgov.proposal.ProposalService;
import com.basketgov.settings.GovernanceSettingsResolver;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class WorkConfiguration {

    @Bean
    public WorkService workService(GovernanceSettingsResolver settingsResolver,
                                   PolicyResolver policyResolver,
                                   ValidatorGateway validatorGateway,
                                   ProposalService proposalService,
                                   OperationContractValidator operationValidator) {
        return new WorkService(settingsResolver, policyResolver, validatorGateway, proposalService,
            operationValidator);
    }
}
