package com.smartroute.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing SmartRoute-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String REQUEST_ID = "requestId";
    public static final String VENUE = "venue";

    private MdcContext() {}

    public static void setRequest(String requestId) {
        MDC.put(REQUEST_ID, requestId);
    }

    public static void setVenue(String requestId, String venue) {
        MDC.put(REQUEST_ID, requestId);
        MDC.put(VENUE, venue);
    }

    public static void clearVenue() {
        MDC.remove(VENUE);
    }

    public static void clear() {
        MDC.remove(REQUEST_ID);
        MDC.remove(VENUE);
    }
}
