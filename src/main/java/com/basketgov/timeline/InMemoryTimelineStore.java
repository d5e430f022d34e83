package com.basketgov.timeline;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
public class InMemoryTimelineStore implements TimelineStore {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<TimelineEvent>> byBasket = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final Clock clock;
    private Instant lastTs = Instant.EPOCH;

    public InMemoryTimelineStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Ids and timestamps are assigned under one lock so each basket's list
     * stays sorted by {@code (ts, id)}: ts never moves backwards even if the
     * clock does.
     */
    @Override
    public synchronized TimelineEvent append(NewTimelineEvent event) {
        Instant now = clock.instant();
        Instant ts = now.isAfter(lastTs) ? now : lastTs;
        lastTs = ts;
        TimelineEvent stored = new TimelineEvent(
            sequence.incrementAndGet(),
            event.basketId(),
            event.kind(),
            event.refId(),
            event.payload(),
            ts,
            event.actorId(),
            event.agentType(),
            event.origin()
        );
        byBasket.computeIfAbsent(event.basketId(), k -> new CopyOnWriteArrayList<>()).add(stored);
        return stored;
    }

    @Override
    public List<TimelineEvent> query(String basketId, TimelineQuery query, int limit) {
        List<TimelineEvent> events = byBasket.get(basketId);
        if (events == null || limit <= 0) {
            return Collections.emptyList();
        }

        List<TimelineEvent> ordered = new ArrayList<>(events);
        if (query.descending()) {
            Collections.reverse(ordered);
        }
        TimelineCursor after = query.after();
        return ordered.stream()
            .filter(e -> after == null || (query.descending()
                ? e.cursor().compareTo(after) < 0
                : e.cursor().compareTo(after) > 0))
            .filter(e -> query.kinds().isEmpty() || query.kinds().contains(e.kind()))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public long count(String basketId) {
        List<TimelineEvent> events = byBasket.get(basketId);
        return events == null ? 0 : events.size();
    }
}
