package com.smartroute.core.execution;

/**
 * A backend could not produce output. The executor moves on to the next venue.
 */
public class ExecutionBackendException extends Exception {

    public ExecutionBackendException(String message) {
        super(message);
    }

    public ExecutionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
