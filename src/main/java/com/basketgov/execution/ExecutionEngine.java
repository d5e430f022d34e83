package com.basketgov.execution;

import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationContractValidator;
import com.basketgov.error.ExecutionFailureException;
import com.basketgov.substrate.SubstrateStore;
import com.basketgov.substrate.SubstrateTransaction;
import com.basketgov.timeline.NewTimelineEvent;
import com.basketgov.timeline.TimelineEmitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies an operation list as one atomic unit against a basket's substrate.
 *
 * <ol>
 *   <li>validate every operation before touching substrate;</li>
 *   <li>apply in list order inside a single basket-locked transaction,
 *       aborting and rolling back on the first failure;</li>
 *   <li>commit and mint one commit id;</li>
 *   <li>only then emit one timeline event per applied mutation.</li>
 * </ol>
 * A failed batch therefore produces no substrate change and no event.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final SubstrateStore substrateStore;
    private final SubstrateOperationHandlers handlers;
    private final OperationContractValidator validator;
    private final TimelineEmitter timeline;

    public ExecutionEngine(SubstrateStore substrateStore,
                           SubstrateOperationHandlers handlers,
                           OperationContractValidator validator,
                           TimelineEmitter timeline) {
        this.substrateStore = substrateStore;
        this.handlers = handlers;
        this.validator = validator;
        this.timeline = timeline;
    }

    public ExecutionResult execute(List<Operation> ops, ExecutionScope scope) {
        validator.validate(ops);

        List<AppliedMutation> mutations = new ArrayList<>(ops.size());
        List<ExecutionLogEntry> executionLog = new ArrayList<>(ops.size());
        String commitId;

        try (SubstrateTransaction tx = substrateStore.begin(scope.basketId())) {
            for (int i = 0; i < ops.size(); i++) {
                Operation op = ops.get(i);
                long started = System.nanoTime();
                try {
                    AppliedMutation mutation = handlers.handlerFor(op.type()).apply(op, i, tx, scope);
                    mutations.add(mutation);
                    executionLog.add(new ExecutionLogEntry(i, op.type(), true, mutation.substrateId(),
                        elapsedMs(started), null));
                } catch (RuntimeException ex) {
                    tx.rollback();
                    log.warn("Execution aborted at op {} ({}) for proposal={} basket={}: {}",
                        i, op.type().getValue(), scope.proposalId(), scope.basketId(), ex.getMessage());
                    throw new ExecutionFailureException(
                        "Operation " + i + " (" + op.type().getValue() + ") failed: " + ex.getMessage(), i, ex);
                }
            }
            commitId = UUID.randomUUID().toString();
            tx.commit();
        }

        log.info("Committed {} operations commit={} proposal={} basket={}",
            mutations.size(), commitId, scope.proposalId(), scope.basketId());

        for (AppliedMutation mutation : mutations) {
            timeline.emit(new NewTimelineEvent(
                scope.basketId(),
                mutation.eventKind(),
                mutation.substrateId(),
                mutationPayload(mutation, commitId, scope),
                scope.actorId(),
                null,
                scope.origin()
            ));
        }

        return new ExecutionResult(commitId, mutations.size(), mutations, executionLog);
    }

    private static Map<String, Object> mutationPayload(AppliedMutation mutation, String commitId, ExecutionScope scope) {
        Map<String, Object> payload = new LinkedHashMap<>(mutation.details());
        payload.put("commit_id", commitId);
        payload.put("operation_index", mutation.operationIndex());
        payload.put("operation_type", mutation.operationType().getValue());
        if (scope.proposalId() != null) {
            payload.put("proposal_id", scope.proposalId());
        }
        return payload;
    }

    private static long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
