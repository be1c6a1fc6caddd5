package com.smartroute.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory pub/sub for {@link RoutingEvent}s.
 * <p>
 * Each subscription carries a filter, so a listener can follow one request, one
 * event type or everything. The most recent events are retained so a listener
 * that attaches after a request started can replay what it missed.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    static final int DEFAULT_RETAINED = 256;

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<RoutingEvent> retained = new ArrayDeque<>();
    private final int retainLimit;

    public EventBus() {
        this(DEFAULT_RETAINED);
    }

    public EventBus(int retainLimit) {
        if (retainLimit < 0) {
            throw new IllegalArgumentException("retainLimit must be >= 0");
        }
        this.retainLimit = retainLimit;
    }

    public void publish(RoutingEvent event) {
        log.debug("Publishing {} for request {}", event.eventType(), event.requestId());
        retain(event);
        for (Listener listener : listeners) {
            if (listener.filter().test(event)) {
                deliver(listener, event);
            }
        }
    }

    /**
     * Subscribes to events matching {@code filter}.
     *
     * @return a handle that removes the subscription
     */
    public Subscription subscribe(Predicate<RoutingEvent> filter, Consumer<RoutingEvent> consumer) {
        var listener = new Listener(Objects.requireNonNull(filter), Objects.requireNonNull(consumer));
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public Subscription subscribe(String requestId, Consumer<RoutingEvent> consumer) {
        return subscribe(forRequest(requestId), consumer);
    }

    public Subscription subscribeAll(Consumer<RoutingEvent> consumer) {
        return subscribe(event -> true, consumer);
    }

    /**
     * Retained events matching {@code filter}, oldest first.
     */
    public List<RoutingEvent> recent(Predicate<RoutingEvent> filter) {
        synchronized (retained) {
            return retained.stream().filter(filter).toList();
        }
    }

    public int subscriberCount() {
        return listeners.size();
    }

    public static Predicate<RoutingEvent> forRequest(String requestId) {
        return event -> requestId.equals(event.requestId());
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void retain(RoutingEvent event) {
        if (retainLimit == 0) {
            return;
        }
        synchronized (retained) {
            if (retained.size() == retainLimit) {
                retained.removeFirst();
            }
            retained.addLast(event);
        }
    }

    private void deliver(Listener listener, RoutingEvent event) {
        try {
            listener.consumer().accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} for request {}: {}", event.eventType(), event.requestId(),
                    e.getMessage(), e);
        }
    }

    private record Listener(Predicate<RoutingEvent> filter, Consumer<RoutingEvent> consumer) {}
}
