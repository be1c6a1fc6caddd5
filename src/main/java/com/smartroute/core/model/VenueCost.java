package com.smartroute.core.model;

/**
 * Estimated cost of running one request on one venue, in USD.
 */
public record VenueCost(double fixedCost, double variableCost, double totalCost) {

    public static VenueCost of(double fixedCost, double variableCost) {
        return new VenueCost(fixedCost, variableCost, fixedCost + variableCost);
    }
}
