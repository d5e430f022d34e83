package com.basketgov.proposal;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Component
public class InMemoryProposalStore implements ProposalStore {

    static final int LOCK_STRIPES = 64;

    private final ConcurrentHashMap<String, Proposal> proposals = new ConcurrentHashMap<>();
    private final ReentrantLock[] rowLocks = new ReentrantLock[LOCK_STRIPES];

    public InMemoryProposalStore() {
        for (int i = 0; i < rowLocks.length; i++) {
            rowLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public Proposal insert(Proposal proposal) {
        if (proposals.putIfAbsent(proposal.id(), proposal) != null) {
            throw new IllegalStateException("proposal id already exists: " + proposal.id());
        }
        return proposal;
    }

    @Override
    public Optional<Proposal> findById(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    @Override
    public List<Proposal> list(String basketId, ProposalStatus status, ProposalKind kind) {
        return proposals.values().stream()
            .filter(p -> basketId.equals(p.basketId()))
            .filter(p -> status == null || status == p.status())
            .filter(p -> kind == null || kind == p.proposalKind())
            .sorted(Comparator.comparing(Proposal::createdAt).reversed())
            .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Ids share a fixed set of lock stripes, so locking an unknown id
     * allocates nothing.
     */
    @Override
    public ProposalLock lock(String proposalId) {
        ReentrantLock lock = stripeFor(proposalId);
        lock.lock();
        AtomicBoolean released = new AtomicBoolean(false);
        return () -> {
            if (released.compareAndSet(false, true)) {
                lock.unlock();
            }
        };
    }

    @Override
    public boolean updateIfNotExecuted(String proposalId, UnaryOperator<Proposal> transition) {
        AtomicBoolean updated = new AtomicBoolean(false);
        proposals.computeIfPresent(proposalId, (id, current) -> {
            if (current.isExecuted()) {
                return current;
            }
            updated.set(true);
            return transition.apply(current);
        });
        return updated.get();
    }

    ReentrantLock stripeFor(String proposalId) {
        return rowLocks[Math.floorMod(proposalId.hashCode(), LOCK_STRIPES)];
    }
}
