package com.basketgov.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable audit record. Ordered within a basket by {@code (ts, id)}.
 */
public record TimelineEvent(
    @JsonProperty("id") long id,
    @JsonProperty("basket_id") String basketId,
    @JsonProperty("kind") String kind,
    @JsonProperty("ref_id") String refId,
    @JsonProperty("payload") Map<String, Object> payload,
    @JsonProperty("ts") Instant ts,
    @JsonProperty("actor_id") String actorId,
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("origin") TimelineOrigin origin
) {

    public TimelineEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public TimelineCursor cursor() {
        return new TimelineCursor(ts, id);
    }
}
