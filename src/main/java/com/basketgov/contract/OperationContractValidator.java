package com.basketgov.contract;

import com.basketgov.error.InvalidOperationsException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses raw operation documents and checks each operation's required
 * fields. Accepts both the nested {@code {type, data:{...}}} form and the
 * flat {@code {type, ...fields}} form.
 */
@Component
public class OperationContractValidator {

    public List<Operation> parse(List<?> rawOps) {
        if (rawOps == null || rawOps.isEmpty()) {
            throw new InvalidOperationsException("ops must contain at least 1 operation");
        }
        List<Operation> ops = new ArrayList<>(rawOps.size());
        for (int i = 0; i < rawOps.size(); i++) {
            ops.add(parseOne(rawOps.get(i), i));
        }
        validate(ops);
        return List.copyOf(ops);
    }

    public void validate(List<Operation> ops) {
        if (ops == null || ops.isEmpty()) {
            throw new InvalidOperationsException("ops must contain at least 1 operation");
        }
        for (int i = 0; i < ops.size(); i++) {
            validateOne(ops.get(i), i);
        }
    }

    private Operation parseOne(Object raw, int index) {
        if (!(raw instanceof Map<?, ?> map)) {
            throw new InvalidOperationsException("ops[" + index + "] must be an object");
        }
        Object rawType = map.get("type");
        if (!(rawType instanceof String typeName) || typeName.isBlank()) {
            throw new InvalidOperationsException("ops[" + index + "].type is required");
        }
        OperationType type = OperationType.parse(typeName)
            .orElseThrow(() -> new InvalidOperationsException(
                "ops[" + index + "] has unsupported operation type: " + typeName));

        Map<String, Object> data = new LinkedHashMap<>();
        if (map.get("data") instanceof Map<?, ?> nested) {
            nested.forEach((k, v) -> data.put(String.valueOf(k), v));
        } else {
            map.forEach((k, v) -> {
                if (!"type".equals(k)) {
                    data.put(String.valueOf(k), v);
                }
            });
        }
        return new Operation(type, data);
    }

    private void validateOne(Operation op, int index) {
        String prefix = "ops[" + index + "] " + op.type().getValue() + " requires ";
        switch (op.type()) {
            case CREATE_BLOCK -> requireString(op, "content", prefix);
            case CREATE_CONTEXT_ITEM -> requireString(op, "label", prefix);
            case CREATE_RAW_DUMP -> {
                if (op.stringField("text_dump") == null && op.stringField("text") == null) {
                    throw new InvalidOperationsException(prefix + "text_dump");
                }
            }
            case REVISE_BLOCK -> {
                requireString(op, "block_id", prefix);
                requireString(op, "content", prefix);
            }
            case UPDATE_CONTEXT_ITEM -> requireString(op, "context_item_id", prefix);
            case MERGE_CONTEXT_ITEMS -> {
                requireString(op, "canonical_id", prefix);
                if (!(op.data().get("from_ids") instanceof List<?> fromIds) || fromIds.isEmpty()) {
                    throw new InvalidOperationsException(prefix + "non-empty from_ids");
                }
            }
            case ATTACH_BLOCK_TO_DOC -> {
                requireString(op, "block_id", prefix);
                requireString(op, "document_id", prefix);
            }
            case PROMOTE_SCOPE -> {
                requireString(op, "block_id", prefix);
                requireString(op, "to_scope", prefix);
            }
        }
        Object confidence = op.data().get("confidence");
        if (confidence != null && !(confidence instanceof Number)) {
            throw new InvalidOperationsException("ops[" + index + "].confidence must be a number");
        }
    }

    private void requireString(Operation op, String field, String prefix) {
        if (op.stringField(field) == null) {
            throw new InvalidOperationsException(prefix + field);
        }
    }
}
