package com.smartroute.core.model;

import java.util.List;

/**
 * Outcome of walking a decision's venue chain.
 *
 * @param requestId    the executed request
 * @param output       backend output, empty on failure
 * @param venueUsed    venue that produced the output, null when every venue failed
 * @param actualCost   estimated cost of the venue used, 0 on failure
 * @param qualityScore backend-reported quality in [0,1]
 * @param latencyMs    total wall time across attempts
 * @param error        {@link #ROUTING_FAILED}, {@link #CANCELLED}, or null on success
 * @param attempts     every attempt in order
 * @param warnings     non-fatal issues such as unmatched anonymization placeholders
 */
public record ExecutionResult(
    String requestId,
    String output,
    Venue venueUsed,
    double actualCost,
    double qualityScore,
    long latencyMs,
    String error,
    List<AttemptRecord> attempts,
    List<String> warnings
) {

    public static final String ROUTING_FAILED = "routing_failed";
    public static final String CANCELLED = "cancelled";

    public ExecutionResult {
        output = output == null ? "" : output;
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public int failedAttempts() {
        return (int) attempts.stream().filter(a -> !a.succeeded()).count();
    }

    public static ExecutionResult failure(String requestId, String error, long latencyMs,
                                          List<AttemptRecord> attempts, List<String> warnings) {
        return new ExecutionResult(requestId, "", null, 0.0, 0.0, latencyMs, error, attempts, warnings);
    }
}
