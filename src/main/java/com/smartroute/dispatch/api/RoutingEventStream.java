package com.smartroute.dispatch.api;

import com.smartroute.core.events.EventBus;
import com.smartroute.core.events.RoutingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Streams {@link RoutingEvent}s to server-sent-event clients.
 * <p>
 * A stream follows either one request or every request. Retained events that
 * match are replayed first, then live events follow until the client goes away
 * or the emitter times out.
 */
@Service
public class RoutingEventStream {

    private static final Logger log = LoggerFactory.getLogger(RoutingEventStream.class);

    private static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;

    private final EventBus eventBus;
    private final long timeoutMs;

    @Autowired
    public RoutingEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    RoutingEventStream(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    /**
     * Opens a stream.
     *
     * @param requestId request to follow, or {@code null} for all requests
     */
    public SseEmitter open(String requestId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Predicate<RoutingEvent> filter = requestId == null ? event -> true : EventBus.forRequest(requestId);
        String label = requestId == null ? "*" : requestId;

        for (RoutingEvent event : eventBus.recent(filter)) {
            send(emitter, event);
        }

        var subscription = new AtomicReference<EventBus.Subscription>();
        subscription.set(eventBus.subscribe(filter, event -> {
            if (!send(emitter, event) && subscription.get() != null) {
                subscription.get().unsubscribe();
            }
        }));

        emitter.onCompletion(() -> close(label, subscription.get()));
        emitter.onTimeout(() -> close(label, subscription.get()));
        emitter.onError(ex -> {
            log.debug("Event stream for {} errored: {}", label, ex.getMessage());
            close(label, subscription.get());
        });

        log.info("Event stream opened for {} (timeout={}ms)", label, timeoutMs);
        return emitter;
    }

    static Map<String, Object> toData(RoutingEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("request_id", event.requestId());
        if (event.venue() != null) {
            data.put("venue", event.venue());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private boolean send(SseEmitter emitter, RoutingEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(toData(event)));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} for request {}: {}", event.eventType(), event.requestId(), e.getMessage());
            return false;
        }
    }

    private void close(String label, EventBus.Subscription subscription) {
        subscription.unsubscribe();
        log.debug("Event stream closed for {}", label);
    }
}
