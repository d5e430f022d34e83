package com.basketgov.timeline;

import java.util.Set;

/**
 * @param after      resume strictly past this position (in the requested direction); null for the start
 * @param limit      maximum events per page
 * @param kinds      event kinds to keep; empty keeps all
 * @param descending newest first when true
 */
public record TimelineQuery(TimelineCursor after, int limit, Set<String> kinds, boolean descending) {

    public TimelineQuery {
        kinds = kinds == null ? Set.of() : Set.copyOf(kinds);
    }

    public static TimelineQuery firstPage(int limit) {
        return new TimelineQuery(null, limit, Set.of(), false);
    }

    public TimelineQuery withAfter(TimelineCursor cursor) {
        return new TimelineQuery(cursor, limit, kinds, descending);
    }
}
