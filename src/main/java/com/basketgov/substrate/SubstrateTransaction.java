package com.basketgov.substrate;

import java.util.Optional;

/**
 * Unit of work over one basket's substrate. Reads see this transaction's own
 * staged writes; nothing becomes visible to others until {@link #commit()}.
 * Closing without committing rolls back.
 */
public interface SubstrateTransaction extends AutoCloseable {

    String basketId();

    Optional<Block> findBlock(String blockId);

    Optional<ContextItem> findContextItem(String contextItemId);

    void putBlock(Block block);

    void putContextItem(ContextItem item);

    void putRawDump(RawDump dump);

    void putAttachment(BlockAttachment attachment);

    void commit();

    void rollback();

    @Override
    void close();
}
