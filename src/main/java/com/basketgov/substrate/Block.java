package com.basketgov.substrate;

import java.time.Instant;

public record Block(
    String id,
    String basketId,
    String workspaceId,
    String content,
    String semanticType,
    double confidence,
    String state,
    String scope,
    Instant createdAt,
    Instant updatedAt
) {

    public Block revise(String newContent, double newConfidence, Instant at) {
        return new Block(id, basketId, workspaceId, newContent, semanticType, newConfidence, state, scope, createdAt, at);
    }

    public Block withScope(String newScope, Instant at) {
        return new Block(id, basketId, workspaceId, content, semanticType, confidence, state, newScope, createdAt, at);
    }
}
