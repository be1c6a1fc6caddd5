package com.smartroute.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while routing or executing a request.
 *
 * @param eventType event type (e.g. "request.routed", "attempt.failed", "request.executed")
 * @param requestId the request this event belongs to
 * @param venue     venue involved (nullable for request-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record RoutingEvent(
    String eventType,
    String requestId,
    String venue,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static RoutingEvent of(String eventType, String requestId, String venue, Map<String, Object> payload) {
        return new RoutingEvent(eventType, requestId, venue, payload, Instant.now());
    }
}
