package com.basketgov.proposal;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface ProposalStore {

    Proposal insert(Proposal proposal);

    Optional<Proposal> findById(String proposalId);

    /** Newest first. Null filters match everything. */
    List<Proposal> list(String basketId, ProposalStatus status, ProposalKind kind);

    /**
     * Row lock on one proposal, held until closed. Concurrent holders of the
     * same proposal id are serialized.
     */
    ProposalLock lock(String proposalId);

    /**
     * Applies {@code transition} only if the stored proposal is not yet
     * executed; the equivalent of {@code UPDATE ... WHERE is_executed = false}.
     *
     * @return true if the row was updated
     */
    boolean updateIfNotExecuted(String proposalId, UnaryOperator<Proposal> transition);

    interface ProposalLock extends AutoCloseable {
        @Override
        void close();
    }
}
