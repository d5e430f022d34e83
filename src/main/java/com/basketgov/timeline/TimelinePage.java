package com.basketgov.timeline;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code nextCursor} is set only when the page was truncated;
 * {@code lastCursor} always points at the final event of this page.
 */
public record TimelinePage(
    @JsonProperty("events") List<TimelineEvent> events,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("next_cursor") String nextCursor,
    @JsonProperty("last_cursor") String lastCursor
) {
}
