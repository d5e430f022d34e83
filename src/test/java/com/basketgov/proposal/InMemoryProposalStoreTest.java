package com.basketgov.proposal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProposalStoreTest {

    private final InMemoryProposalStore store = new InMemoryProposalStore();

    @Test
    @DisplayName("Locking unknown ids draws from a fixed lock table")
    void lockingUnknownIdsStaysBounded() {
        Set<ReentrantLock> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < 10_000; i++) {
            String id = UUID.randomUUID().toString();
            try (ProposalStore.ProposalLock ignored = store.lock(id)) {
                seen.add(store.stripeFor(id));
            }
        }

        assertTrue(seen.size() <= InMemoryProposalStore.LOCK_STRIPES,
            "lock table grew to " + seen.size());
        assertTrue(seen.stream().noneMatch(ReentrantLock::isLocked), "every lock released");
    }

    @Test
    @DisplayName("Holders of the same proposal id are serialized")
    void sameIdIsSerialized() throws Exception {
        String id = UUID.randomUUID().toString();
        CountDownLatch acquired = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> contender;
            try (ProposalStore.ProposalLock ignored = store.lock(id)) {
                contender = pool.submit(() -> {
                    try (ProposalStore.ProposalLock inner = store.lock(id)) {
                        acquired.countDown();
                    }
                });
                assertFalse(acquired.await(200, TimeUnit.MILLISECONDS), "second holder must wait");
            }
            assertTrue(acquired.await(5, TimeUnit.SECONDS));
            contender.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void closingTwiceReleasesOnce() {
        String id = UUID.randomUUID().toString();
        ProposalStore.ProposalLock lock = store.lock(id);
        lock.close();
        lock.close();
        assertFalse(store.stripeFor(id).isLocked());
    }
}
