package com.smartroute.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-venue cost estimate for one request.
 *
 * @param inputTokens   estimated prompt tokens
 * @param outputTokens  estimated completion tokens
 * @param costs         one entry per candidate venue
 * @param baselineVenue the most expensive remote venue
 * @param baselineCost  total cost of {@code baselineVenue}
 * @param usedDefaultPricing true when the fallback price table had to be used
 */
public record CostEstimate(
    int inputTokens,
    int outputTokens,
    Map<Venue, VenueCost> costs,
    Venue baselineVenue,
    double baselineCost,
    boolean usedDefaultPricing
) {

    public CostEstimate {
        costs = costs.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(costs));
    }

    public int totalTokens() {
        return inputTokens + outputTokens;
    }

    public double costOf(Venue venue) {
        VenueCost cost = costs.get(venue);
        return cost == null ? 0.0 : cost.totalCost();
    }

    /**
     * Savings of {@code venue} relative to the baseline venue.
     */
    public double savings(Venue venue) {
        return baselineCost - costOf(venue);
    }
}
