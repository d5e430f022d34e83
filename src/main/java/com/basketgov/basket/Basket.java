package com.basketgov.basket;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Basket(
    @JsonProperty("id") String id,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("name") String name,
    @JsonProperty("created_at") Instant createdAt
) {
}
