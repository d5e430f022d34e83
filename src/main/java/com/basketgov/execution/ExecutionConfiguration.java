package com.basketgov.execution;

import com.basketgov.contract.OperationContractValidator;
import com.basketgov.substrate.SubstrateStore;
import com.basketgov.timeline.TimelineEmitter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExecutionConfiguration {

    @Bean
    public SubstrateOperationHandlers substrateOperationHandlers(Clock clock) {
        return new SubstrateOperationHandlers(clock);
    }

    @Bean
    public ExecutionEngine executionEngine(SubstrateStore substrateStore,
                                           SubstrateOperationHandlers handlers,
                                           OperationContractValidator validator,
                                           TimelineEmitter timelineEmitter) {
        return new ExecutionEngine(substrateStore, handlers, validator, timelineEmitter);
    }
}
