package com.smartroute.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of the accounting counters.
 *
 * @param totalRequests          requests recorded since start or last reset
 * @param successfulRequests     requests that produced output
 * @param failedRequests         requests whose chain was exhausted or cancelled
 * @param failedAttempts         individual venue attempts that failed
 * @param perVenueCounts         successful executions per venue
 * @param perStrategyCounts      decisions per strategy
 * @param perSensitivityCounts   requests per sensitivity level
 * @param totalActualCost        summed cost of venues actually used
 * @param totalBaselineCost      summed baseline (most expensive remote) cost
 * @param totalCostSaved         summed baseline minus actual cost for successful requests
 * @param tokensKeptLocal        estimated tokens of requests served by the local venue
 * @param privacyViolations      executions that broke the decision's privacy constraints
 * @param averageLatencyMs       running mean latency of successful requests
 * @param averageQuality         running mean quality of successful requests
 * @param recentSavings          cost saved within the rolling window
 * @param recentRequests         requests within the rolling window
 * @param since                  when counting started
 * @param takenAt                when this snapshot was taken
 */
public record AccountingSnapshot(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    long failedAttempts,
    Map<Venue, Long> perVenueCounts,
    Map<RoutingStrategy, Long> perStrategyCounts,
    Map<SensitivityLevel, Long> perSensitivityCounts,
    double totalActualCost,
    double totalBaselineCost,
    double totalCostSaved,
    long tokensKeptLocal,
    long privacyViolations,
    double averageLatencyMs,
    double averageQuality,
    double recentSavings,
    long recentRequests,
    Instant since,
    Instant takenAt
) {

    public AccountingSnapshot {
        perVenueCounts = Map.copyOf(perVenueCounts);
        perStrategyCounts = Map.copyOf(perStrategyCounts);
        perSensitivityCounts = Map.copyOf(perSensitivityCounts);
    }

    public double successRate() {
        return totalRequests == 0 ? 0.0 : (double) successfulRequests / totalRequests;
    }

    public double savingsRate() {
        return totalBaselineCost <= 0 ? 0.0 : totalCostSaved / totalBaselineCost;
    }

    public double privacyComplianceRate() {
        return totalRequests == 0 ? 1.0 : 1.0 - (double) privacyViolations / totalRequests;
    }

    public long venueCount(Venue venue) {
        return perVenueCounts.getOrDefault(venue, 0L);
    }
}
