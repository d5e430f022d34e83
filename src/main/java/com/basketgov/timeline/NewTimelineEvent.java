package com.basketgov.timeline;

import java.util.Map;

/**
 * An event about to be appended; the store assigns {@code id} and {@code ts}.
 */
public record NewTimelineEvent(
    String basketId,
    String kind,
    String refId,
    Map<String, Object> payload,
    String actorId,
    String agentType,
    TimelineOrigin origin
) {
}
