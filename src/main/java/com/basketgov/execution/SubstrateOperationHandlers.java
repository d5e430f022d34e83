package com.basketgov.execution;

import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationType;
import com.basketgov.substrate.Block;
import com.basketgov.substrate.BlockAttachment;
import com.basketgov.substrate.ContextItem;
import com.basketgov.substrate.RawDump;
import com.basketgov.substrate.SubstrateTransaction;
import com.basketgov.timeline.TimelineKinds;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Handler table for every {@link OperationType}. Operations only touch
 * entities of the basket being executed.
 */
public class SubstrateOperationHandlers {

    static final double DEFAULT_CONFIDENCE = 0.7;

    private final Clock clock;
    private final Supplier<String> idGenerator;

    public SubstrateOperationHandlers(Clock clock) {
        this(clock, () -> UUID.randomUUID().toString());
    }

    public SubstrateOperationHandlers(Clock clock, Supplier<String> idGenerator) {
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    public OperationHandler handlerFor(OperationType type) {
        return switch (type) {
            case CREATE_BLOCK -> this::createBlock;
            case CREATE_CONTEXT_ITEM -> this::createContextItem;
            case CREATE_RAW_DUMP -> this::createRawDump;
            case REVISE_BLOCK -> this::reviseBlock;
            case UPDATE_CONTEXT_ITEM -> this::updateContextItem;
            case MERGE_CONTEXT_ITEMS -> this::mergeContextItems;
            case ATTACH_BLOCK_TO_DOC -> this::attachBlockToDoc;
            case PROMOTE_SCOPE -> this::promoteScope;
        };
    }

    private AppliedMutation createBlock(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        Instant now = clock.instant();
        String semanticType = op.stringField("semantic_type");
        Block block = new Block(idGenerator.get(), tx.basketId(), scope.workspaceId(),
            op.stringField("content"), semanticType,
            confidence(op, DEFAULT_CONFIDENCE), "ACCEPTED", "LOCAL", now, now);
        tx.putBlock(block);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("block_id", block.id());
        if (semanticType != null) {
            details.put("semantic_type", semanticType);
        }
        return new AppliedMutation(index, op.type(), block.id(), TimelineKinds.BLOCK_CREATED, details);
    }

    private AppliedMutation createContextItem(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        String kind = op.stringField("kind") != null ? op.stringField("kind") : "concept";
        ContextItem item = new ContextItem(idGenerator.get(), tx.basketId(), op.stringField("label"), kind,
            confidence(op, DEFAULT_CONFIDENCE), ContextItem.ACTIVE, stringList(op.data().get("synonyms")),
            clock.instant());
        tx.putContextItem(item);
        return new AppliedMutation(index, op.type(), item.id(), TimelineKinds.CONTEXT_ITEM_CREATED,
            Map.of("context_item_id", item.id(), "label", item.label(), "kind", kind));
    }

    private AppliedMutation createRawDump(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        String text = op.stringField("text_dump") != null ? op.stringField("text_dump") : op.stringField("text");
        Map<String, Object> sourceMeta = new LinkedHashMap<>();
        if (op.data().get("source_meta") instanceof Map<?, ?> meta) {
            meta.forEach((k, v) -> {
                if (v != null) {
                    sourceMeta.put(String.valueOf(k), v);
                }
            });
        }
        RawDump dump = new RawDump(idGenerator.get(), tx.basketId(), scope.workspaceId(), text, sourceMeta,
            clock.instant());
        tx.putRawDump(dump);
        return new AppliedMutation(index, op.type(), dump.id(), TimelineKinds.DUMP_CREATED,
            Map.of("dump_id", dump.id(), "length", text.length()));
    }

    private AppliedMutation reviseBlock(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        Block existing = requireBlock(tx, op.stringField("block_id"));
        Block revised = existing.revise(op.stringField("content"), confidence(op, existing.confidence()),
            clock.instant());
        tx.putBlock(revised);
        return new AppliedMutation(index, op.type(), revised.id(), TimelineKinds.BLOCK_REVISED,
            Map.of("block_id", revised.id()));
    }

    private AppliedMutation updateContextItem(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        ContextItem existing = requireContextItem(tx, op.stringField("context_item_id"));
        String label = op.stringField("label") != null ? op.stringField("label") : existing.label();
        String kind = op.stringField("kind") != null ? op.stringField("kind") : existing.kind();

        List<String> synonyms = existing.synonyms();
        if (op.data().get("synonyms") instanceof List<?>) {
            synonyms = stringList(op.data().get("synonyms"));
        } else if (op.data().get("additional_synonyms") instanceof List<?>) {
            LinkedHashSet<String> combined = new LinkedHashSet<>(existing.synonyms());
            combined.addAll(stringList(op.data().get("additional_synonyms")));
            synonyms = new ArrayList<>(combined);
        }

        ContextItem updated = existing.update(label, kind, confidence(op, existing.confidence()), synonyms,
            clock.instant());
        tx.putContextItem(updated);
        return new AppliedMutation(index, op.type(), updated.id(), TimelineKinds.CONTEXT_ITEM_UPDATED,
            Map.of("context_item_id", updated.id()));
    }

    private AppliedMutation mergeContextItems(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        String canonicalId = op.stringField("canonical_id");
        requireContextItem(tx, canonicalId);
        List<String> fromIds = stringList(op.data().get("from_ids"));
        if (fromIds.contains(canonicalId)) {
            throw new OperationRejectedException("canonical_id " + canonicalId + " cannot also be merged away");
        }
        Instant now = clock.instant();
        for (String fromId : fromIds) {
            tx.putContextItem(requireContextItem(tx, fromId).mergedInto(now));
        }
        return new AppliedMutation(index, op.type(), canonicalId, TimelineKinds.CONTEXT_ITEM_MERGED,
            Map.of("canonical_id", canonicalId, "merged_ids", fromIds));
    }

    private AppliedMutation attachBlockToDoc(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        Block block = requireBlock(tx, op.stringField("block_id"));
        String documentId = op.stringField("document_id");
        tx.putAttachment(new BlockAttachment(block.id(), documentId, tx.basketId(), clock.instant()));
        return new AppliedMutation(index, op.type(), block.id(), TimelineKinds.BLOCK_ATTACHED,
            Map.of("block_id", block.id(), "document_id", documentId));
    }

    private AppliedMutation promoteScope(Operation op, int index, SubstrateTransaction tx, ExecutionScope scope) {
        Block existing = requireBlock(tx, op.stringField("block_id"));
        String toScope = op.stringField("to_scope");
        tx.putBlock(existing.withScope(toScope, clock.instant()));
        return new AppliedMutation(index, op.type(), existing.id(), TimelineKinds.BLOCK_SCOPE_PROMOTED,
            Map.of("block_id", existing.id(), "from_scope", Objects.toString(existing.scope(), ""),
                "to_scope", toScope));
    }

    private Block requireBlock(SubstrateTransaction tx, String blockId) {
        return tx.findBlock(blockId)
            .filter(b -> tx.basketId().equals(b.basketId()))
            .orElseThrow(() -> new OperationRejectedException("Block not found in basket: " + blockId));
    }

    private ContextItem requireContextItem(SubstrateTransaction tx, String contextItemId) {
        return tx.findContextItem(contextItemId)
            .filter(c -> tx.basketId().equals(c.basketId()))
            .filter(c -> !ContextItem.MERGED.equals(c.state()))
            .orElseThrow(() -> new OperationRejectedException("Context item not found in basket: " + contextItemId));
    }

    private static double confidence(Operation op, double fallback) {
        return op.data().get("confidence") instanceof Number n ? n.doubleValue() : fallback;
    }

    private static List<String> stringList(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<String> values = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item != null) {
                values.add(String.valueOf(item));
            }
        }
        return values;
    }
}
