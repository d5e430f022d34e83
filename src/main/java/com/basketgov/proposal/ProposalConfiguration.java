package com.basketgov.proposal;

import com.basketgov.contract.OperationContractValidator;
import com.basketgov.execution.ExecutionEngine;
import com.basketgov.settings.GovernanceSettingsResolver;
import com.basketgov.timeline.TimelineEmitter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProposalConfiguration {

    @Bean
    public ProposalService proposalService(ProposalStore proposalStore,
                                           ExecutionEngine executionEngine,
                                           OperationContractValidator operationValidator,
                                           TimelineEmitter timelineEmitter,
                                           GovernanceSettingsResolver settingsResolver,
                                           Clock clock) {
        return new ProposalService(proposalStore, executionEngine, operationValidator,
            timelineEmitter, settingsResolver, clock);
    }
}
