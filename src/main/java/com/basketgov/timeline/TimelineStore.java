package com.basketgov.timeline;

import java.util.List;

/**
 * Append-only event log partitioned by basket. No update or delete.
 */
public interface TimelineStore {

    TimelineEvent append(NewTimelineEvent event);

    /**
     * Returns up to {@code limit} events of the basket in {@code (ts, id)}
     * order (reversed when {@code query.descending()}), strictly past
     * {@code query.after()}.
     */
    List<TimelineEvent> query(String basketId, TimelineQuery query, int limit);

    long count(String basketId);
}
