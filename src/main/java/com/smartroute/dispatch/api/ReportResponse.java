package com.smartroute.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartroute.core.model.AccountingSnapshot;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON view of an {@link AccountingSnapshot}, grouped into cost and privacy sections.
 */
public record ReportResponse(
    @JsonProperty("total_requests") long totalRequests,
    @JsonProperty("successful_requests") long successfulRequests,
    @JsonProperty("failed_requests") long failedRequests,
    @JsonProperty("failed_attempts") long failedAttempts,
    @JsonProperty("success_rate") double successRate,
    @JsonProperty("per_venue_counts") Map<String, Long> perVenueCounts,
    @JsonProperty("per_strategy_counts") Map<String, Long> perStrategyCounts,
    @JsonProperty("average_latency_ms") double averageLatencyMs,
    @JsonProperty("average_quality") double averageQuality,
    Cost cost,
    Privacy privacy,
    Instant since,
    @JsonProperty("taken_at") Instant takenAt
) {

    public record Cost(
        @JsonProperty("total_actual_cost") double totalActualCost,
        @JsonProperty("total_baseline_cost") double totalBaselineCost,
        @JsonProperty("total_cost_saved") double totalCostSaved,
        @JsonProperty("savings_rate") double savingsRate,
        @JsonProperty("tokens_kept_local") long tokensKeptLocal,
        @JsonProperty("recent_savings") double recentSavings,
        @JsonProperty("recent_requests") long recentRequests
    ) {}

    public record Privacy(
        @JsonProperty("privacy_violations") long privacyViolations,
        @JsonProperty("privacy_compliance_rate") double privacyComplianceRate,
        @JsonProperty("per_sensitivity_counts") Map<String, Long> perSensitivityCounts
    ) {}

    public static ReportResponse from(AccountingSnapshot s) {
        return new ReportResponse(s.totalRequests(), s.successfulRequests(), s.failedRequests(),
                s.failedAttempts(), s.successRate(), names(s.perVenueCounts()), names(s.perStrategyCounts()),
                s.averageLatencyMs(), s.averageQuality(),
                new Cost(s.totalActualCost(), s.totalBaselineCost(), s.totalCostSaved(), s.savingsRate(),
                        s.tokensKeptLocal(), s.recentSavings(), s.recentRequests()),
                new Privacy(s.privacyViolations(), s.privacyComplianceRate(), names(s.perSensitivityCounts())),
                s.since(), s.takenAt());
    }

    private static Map<String, Long> names(Map<? extends Enum<?>, Long> counts) {
        Map<String, Long> out = new TreeMap<>();
        counts.forEach((k, v) -> out.put(k.name(), v));
        return out;
    }
}
