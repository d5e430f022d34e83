package com.basketgov.execution;

import com.basketgov.contract.Operation;
import com.basketgov.substrate.SubstrateTransaction;

/**
 * Applies one operation inside an open substrate transaction. Must only
 * write through {@code tx}; throwing aborts and rolls back the whole batch.
 */
@FunctionalInterface
public interface OperationHandler {

    AppliedMutation apply(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope);
}
