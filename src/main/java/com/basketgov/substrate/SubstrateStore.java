package com.basketgov.substrate;

import java.util.List;
import java.util.Optional;

public interface SubstrateStore {

    /**
     * Opens a transaction holding the basket's write lock until it is
     * committed, rolled back or closed. Writers to the same basket are
     * serialized; other baskets proceed in parallel.
     */
    SubstrateTransaction begin(String basketId);

    Optional<Block> findBlock(String blockId);

    Optional<ContextItem> findContextItem(String contextItemId);

    List<Block> blocks(String basketId);

    List<ContextItem> contextItems(String basketId);

    List<RawDump> rawDumps(String basketId);

    List<BlockAttachment> attachments(String basketId);
}
