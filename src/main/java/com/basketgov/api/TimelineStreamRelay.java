package com.basketgov.api;

import com.basketgov.timeline.TimelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Timeline subscriber feeding one SSE client. Matching events are queued on
 * the sender executor, so a slow client never blocks the emitting caller.
 */
final class TimelineStreamRelay implements Consumer<TimelineEvent> {

    private static final Logger log = LoggerFactory.getLogger(TimelineStreamRelay.class);

    private final String basketId;
    private final List<String> eventTypes;
    private final SseEmitter emitter;
    private final Executor sender;

    TimelineStreamRelay(String basketId, List<String> eventTypes, SseEmitter emitter, Executor sender) {
        this.basketId = basketId;
        this.eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        this.emitter = emitter;
        this.sender = sender;
    }

    @Override
    public void accept(TimelineEvent event) {
        if (!basketId.equals(event.basketId())) {
            return;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.kind())) {
            return;
        }
        try {
            sender.execute(() -> send(event));
        } catch (RejectedExecutionException ex) {
            log.warn("Timeline stream dropped event={} basket={}: sender unavailable", event.id(), basketId);
        }
    }

    private void send(TimelineEvent event) {
        try {
            emitter.send(SseEmitter.event()
                .id(event.cursor().encode())
                .name(event.kind())
                .data(event));
        } catch (IOException | IllegalStateException ex) {
            emitter.completeWithError(ex);
        }
    }
}
