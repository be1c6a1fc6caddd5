package com.smartroute.core.execution;

import java.time.Duration;

/**
 * A backend exceeded its time allowance.
 */
public class ExecutionTimeoutException extends ExecutionBackendException {

    public ExecutionTimeoutException(String backend, Duration timeout) {
        super(backend + " did not respond within " + timeout.toMillis() + "ms");
    }
}
