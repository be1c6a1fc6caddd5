package com.smartroute.core.cost;

/**
 * Price of one venue: a fixed amount per call plus per-1K-token rates.
 */
public record VenuePricing(double inputPer1k, double outputPer1k, double fixedPerCall) {

    public VenuePricing {
        if (inputPer1k < 0 || outputPer1k < 0 || fixedPerCall < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }

    public double variableCost(int inputTokens, int outputTokens) {
        return inputTokens / 1000.0 * inputPer1k + outputTokens / 1000.0 * outputPer1k;
    }
}
