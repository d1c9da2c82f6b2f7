package com.flightcover.api;

import com.flightcover.bus.PolicyEvent;
import com.flightcover.bus.PolicyEventFilter;
import com.flightcover.bus.PolicyEventPublisher;
import com.flightcover.bus.PolicyEventType;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;

/**
 * Policy notifications: query the log or follow it live over SSE. Both
 * accept the same policyId / holder / type filter.
 */
@RestController
@RequestMapping("/v1/events")
public class EventController {

    private static final int MAX_LIMIT = 1000;

    private final PolicyEventPublisher publisher;

    public EventController(PolicyEventPublisher publisher) {
        this.publisher = publisher;
    }

    @GetMapping
    public List<PolicyEvent> query(@RequestParam(required = false) Long policyId,
                                   @RequestParam(required = false) String holder,
                                   @RequestParam(required = false) PolicyEventType type,
                                   @RequestParam(defaultValue = "100") int limit) {
        return publisher.query(new PolicyEventFilter(policyId, holder, type), Math.min(limit, MAX_LIMIT));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) Long policyId,
                             @RequestParam(required = false) String holder,
                             @RequestParam(required = false) PolicyEventType type) {
        PolicyEventFilter filter = new PolicyEventFilter(policyId, holder, type);
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = publisher.subscribe(event -> {
            if (!filter.matches(event)) {
                return;
            }
            try {
                emitter.send(SseEmitter.event()
                    .name(event.type().name())
                    .id(String.valueOf(event.sequenceNumber()))
                    .data(event));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> publisher.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> publisher.unsubscribe(subscriptionId));
        emitter.onError(ex -> publisher.unsubscribe(subscriptionId));
        return emitter;
    }
}
