package com.basketgov.timeline;

/**
 * Dotted event kinds written by the governance pipeline.
 */
public final class TimelineKinds {

    public static final String PROPOSAL_CREATED = "proposal.created";
    public static final String PROPOSAL_APPROVED = "proposal.approved";
    public static final String PROPOSAL_REJECTED = "proposal.rejected";
    public static final String SUBSTRATE_COMMITTED = "substrate.committed";

    public static final String BLOCK_CREATED = "block.created";
    public static final String BLOCK_REVISED = "block.revised";
    public static final String BLOCK_ATTACHED = "block.attached";
    public static final String BLOCK_SCOPE_PROMOTED = "block.scope_promoted";
    public static final String CONTEXT_ITEM_CREATED = "context_item.created";
    public static final String CONTEXT_ITEM_UPDATED = "context_item.updated";
    public static final String CONTEXT_ITEM_MERGED = "context_item.merged";
    public static final String DUMP_CREATED = "dump.created";

    private TimelineKinds() {
    }
}
