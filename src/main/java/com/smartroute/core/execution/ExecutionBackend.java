package com.smartroute.core.execution;

import java.time.Duration;

/**
 * Executes content on one venue. Implementations are supplied per venue and
 * must respond to thread interruption, which is how attempts are cancelled.
 */
public interface ExecutionBackend {

    /**
     * @param content  text to process, already anonymized where the venue requires it
     * @param taskType task type of the request
     * @param timeout  time allowance for this call
     * @throws ExecutionBackendException when no usable output was produced
     */
    BackendResponse execute(String content, String taskType, Duration timeout) throws ExecutionBackendException;

    default String name() {
        return getClass().getSimpleName();
    }
}
