package com.smartroute.core.model;

/**
 * Base type for internal routing faults. These are recovered inside the
 * pipeline and never reach callers of the router.
 */
public class RoutingException extends RuntimeException {

    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
