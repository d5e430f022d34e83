package com.basketgov.substrate;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Substrate held in memory with per-basket write locks. Transactions stage
 * writes privately and publish them in one step on commit.
 */
@Component
public class InMemorySubstrateStore implements SubstrateStore {

    private final ConcurrentHashMap<String, Block> blocks = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ContextItem> contextItems = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RawDump> rawDumps = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<BlockAttachment> attachments = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, ReentrantLock> basketLocks = new ConcurrentHashMap<>();

    @Override
    public SubstrateTransaction begin(String basketId) {
        ReentrantLock lock = basketLocks.computeIfAbsent(basketId, k -> new ReentrantLock());
        lock.lock();
        return new StagedTransaction(basketId, lock);
    }

    @Override
    public Optional<Block> findBlock(String blockId) {
        return Optional.ofNullable(blocks.get(blockId));
    }

    @Override
    public Optional<ContextItem> findContextItem(String contextItemId) {
        return Optional.ofNullable(contextItems.get(contextItemId));
    }

    @Override
    public List<Block> blocks(String basketId) {
        return blocks.values().stream()
            .filter(b -> basketId.equals(b.basketId()))
            .sorted(Comparator.comparing(Block::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<ContextItem> contextItems(String basketId) {
        return contextItems.values().stream()
            .filter(c -> basketId.equals(c.basketId()))
            .collect(Collectors.toList());
    }

    @Override
    public List<RawDump> rawDumps(String basketId) {
        return rawDumps.values().stream()
            .filter(d -> basketId.equals(d.basketId()))
            .sorted(Comparator.comparing(RawDump::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<BlockAttachment> attachments(String basketId) {
        return attachments.stream()
            .filter(a -> basketId.equals(a.basketId()))
            .collect(Collectors.toList());
    }

    private synchronized void publish(Map<String, Block> stagedBlocks,
                                      Map<String, ContextItem> stagedItems,
                                      Map<String, RawDump> stagedDumps,
                                      List<BlockAttachment> stagedAttachments) {
        blocks.putAll(stagedBlocks);
        contextItems.putAll(stagedItems);
        rawDumps.putAll(stagedDumps);
        attachments.addAll(stagedAttachments);
    }

    private final class StagedTransaction implements SubstrateTransaction {

        private final String basketId;
        private final ReentrantLock lock;
        private final Map<String, Block> stagedBlocks = new LinkedHashMap<>();
        private final Map<String, ContextItem> stagedItems = new LinkedHashMap<>();
        private final Map<String, RawDump> stagedDumps = new LinkedHashMap<>();
        private final List<BlockAttachment> stagedAttachments = new ArrayList<>();
        private boolean finished;

        private StagedTransaction(String basketId, ReentrantLock lock) {
            this.basketId = basketId;
            this.lock = lock;
        }

        @Override
        public String basketId() {
            return basketId;
        }

        @Override
        public Optional<Block> findBlock(String blockId) {
            ensureOpen();
            Block staged = stagedBlocks.get(blockId);
            return staged != null ? Optional.of(staged) : InMemorySubstrateStore.this.findBlock(blockId);
        }

        @Override
        public Optional<ContextItem> findContextItem(String contextItemId) {
            ensureOpen();
            ContextItem staged = stagedItems.get(contextItemId);
            return staged != null ? Optional.of(staged) : InMemorySubstrateStore.this.findContextItem(contextItemId);
        }

        @Override
        public void putBlock(Block block) {
            ensureOpen();
            stagedBlocks.put(block.id(), block);
        }

        @Override
        public void putContextItem(ContextItem item) {
            ensureOpen();
            stagedItems.put(item.id(), item);
        }

        @Override
        public void putRawDump(RawDump dump) {
            ensureOpen();
            stagedDumps.put(dump.id(), dump);
        }

        @Override
        public void putAttachment(BlockAttachment attachment) {
            ensureOpen();
            stagedAttachments.add(attachment);
        }

        @Override
        public void commit() {
            ensureOpen();
            try {
                publish(stagedBlocks, stagedItems, stagedDumps, stagedAttachments);
            } finally {
                finish();
            }
        }

        @Override
        public void rollback() {
            if (!finished) {
                finish();
            }
        }

        @Override
        public void close() {
            rollback();
        }

        private void finish() {
            finished = true;
            stagedBlocks.clear();
            stagedItems.clear();
            stagedDumps.clear();
            stagedAttachments.clear();
            lock.unlock();
        }

        private void ensureOpen() {
            if (finished) {
                throw new IllegalStateException("transaction on basket " + basketId + " already finished");
            }
        }
    }
}
