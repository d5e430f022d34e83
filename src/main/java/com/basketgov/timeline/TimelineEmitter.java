package com.basketgov.timeline;

import com.basketgov.GovernanceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Appends audit events and serves the cursor-paginated basket feed.
 *
 * Emission is a non-critical side effect: store failures are logged and
 * reported as {@link EmitOutcome.Dropped}, never thrown.
 */
@Service
public class TimelineEmitter {

    private static final Logger log = LoggerFactory.getLogger(TimelineEmitter.class);

    private final TimelineStore store;
    private final int defaultPageSize;
    private final int maxPageSize;
    private final ConcurrentHashMap<String, Consumer<TimelineEvent>> subscribers = new ConcurrentHashMap<>();

    public TimelineEmitter(TimelineStore store, GovernanceProperties properties) {
        this.store = store;
        this.defaultPageSize = properties.getTimeline().getDefaultPageSize();
        this.maxPageSize = properties.getTimeline().getMaxPageSize();
    }

    public EmitOutcome emit(String basketId, String kind, String refId, Map<String, Object> payload,
                            String actorId, TimelineOrigin origin) {
        return emit(new NewTimelineEvent(basketId, kind, refId, payload, actorId, null, origin));
    }

    public EmitOutcome emit(NewTimelineEvent event) {
        TimelineEvent appended;
        try {
            appended = store.append(event);
        } catch (RuntimeException ex) {
            log.warn("Timeline emission dropped kind={} basket={} ref={}: {}",
                event.kind(), event.basketId(), event.refId(), ex.getMessage());
            return new EmitOutcome.Dropped(event.kind(), ex.getMessage());
        }
        notifySubscribers(appended);
        return new EmitOutcome.Recorded(appended);
    }

    public TimelinePage list(String basketId, TimelineQuery query) {
        int limit = clampLimit(query.limit());
        List<TimelineEvent> fetched = store.query(basketId, query, limit + 1);
        boolean hasMore = fetched.size() > limit;
        List<TimelineEvent> page = hasMore ? List.copyOf(fetched.subList(0, limit)) : List.copyOf(fetched);

        String lastCursor = page.isEmpty() ? null : page.get(page.size() - 1).cursor().encode();
        return new TimelinePage(page, hasMore, hasMore ? lastCursor : null, lastCursor);
    }

    public int defaultPageSize() {
        return defaultPageSize;
    }

    public String subscribe(Consumer<TimelineEvent> consumer) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, consumer);
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    private int clampLimit(int requested) {
        if (requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private void notifySubscribers(TimelineEvent event) {
        subscribers.values().forEach(consumer -> {
            try {
                consumer.accept(event);
            } catch (Exception ex) {
                log.warn("Timeline subscriber failed for event={}: {}", event.id(), ex.getMessage());
            }
        });
    }
}
