package com.smartroute.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartroute.core.model.ExecutionResult;

import java.util.List;

/**
 * JSON view of an {@link ExecutionResult}.
 */
public record ExecutionResponse(
    @JsonProperty("request_id") String requestId,
    String output,
    @JsonProperty("venue_used") String venueUsed,
    @JsonProperty("actual_cost") double actualCost,
    @JsonProperty("quality_score") double qualityScore,
    @JsonProperty("latency_ms") long latencyMs,
    String error,
    List<Attempt> attempts,
    List<String> warnings
) {

    public record Attempt(String venue, String outcome, @JsonProperty("latency_ms") long latencyMs, String detail) {}

    public static ExecutionResponse from(ExecutionResult r) {
        return new ExecutionResponse(r.requestId(), r.output(),
                r.venueUsed() == null ? null : r.venueUsed().name(),
                r.actualCost(), r.qualityScore(), r.latencyMs(), r.error(),
                r.attempts().stream()
                        .map(a -> new Attempt(a.venue().name(), a.outcome().name(), a.latencyMs(), a.detail()))
                        .toList(),
                r.warnings());
    }
}
