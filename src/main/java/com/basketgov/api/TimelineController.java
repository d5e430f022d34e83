package com.basketgov.api;

import com.basketgov.basket.BasketService;
import com.basketgov.error.InvalidRequestException;
import com.basketgov.timeline.TimelineCursor;
import com.basketgov.timeline.TimelineEmitter;
import com.basketgov.timeline.TimelinePage;
import com.basketgov.timeline.TimelineQuery;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/v1/baskets/{basketId}/timeline")
public class TimelineController {

    private final TimelineEmitter timeline;
    private final BasketService basketService;
    private final ExecutorService streamExecutor;

    public TimelineController(TimelineEmitter timeline,
                              BasketService basketService,
                              @Qualifier("timelineStreamExecutor") ExecutorService streamExecutor) {
        this.timeline = timeline;
        this.basketService = basketService;
        this.streamExecutor = streamExecutor;
    }

    @GetMapping
    public TimelinePage list(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                             @PathVariable String basketId,
                             @RequestParam(required = false) String cursor,
                             @RequestParam(required = false) Integer limit,
                             @RequestParam(name = "event_type", required = false) List<String> eventTypes,
                             @RequestParam(defaultValue = "asc") String order) {
        String basket = requireBasket(caller, basketId);
        boolean descending = switch (order.trim()) {
            case "asc" -> false;
            case "desc" -> true;
            default -> throw new InvalidRequestException("order must be one of: asc, desc");
        };
        TimelineQuery query = new TimelineQuery(
            TimelineCursor.parse(cursor),
            limit != null ? limit : timeline.defaultPageSize(),
            eventTypes == null ? Set.of() : Set.copyOf(eventTypes),
            descending
        );
        return timeline.list(basket, query);
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestAttribute(CallerContext.ATTRIBUTE) CallerContext caller,
                             @PathVariable String basketId,
                             @RequestParam(name = "event_type", required = false) List<String> eventTypes) {
        String basket = requireBasket(caller, basketId);
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = timeline.subscribe(
            new TimelineStreamRelay(basket, eventTypes, emitter, streamExecutor));

        emitter.onCompletion(() -> timeline.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> timeline.unsubscribe(subscriptionId));
        emitter.onError(ex -> timeline.unsubscribe(subscriptionId));
        return emitter;
    }

    private String requireBasket(CallerContext caller, String basketId) {
        return basketService.requireInWorkspace(RequestFields.requireUuid(basketId, "basket id"),
            caller.workspaceId()).id();
    }
}
