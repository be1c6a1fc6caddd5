package com.smartroute.core.model;

/**
 * How well the local venue is expected to handle a task.
 */
public enum CapabilityTier {
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    private final int rank;

    CapabilityTier(int rank) {
        this.rank = rank;
    }

    public boolean atLeast(CapabilityTier other) {
        return rank >= other.rank;
    }

    public static CapabilityTier fromScore(double score) {
        if (score >= 0.8) {
            return HIGH;
        }
        if (score >= 0.6) {
            return MEDIUM;
        }
        return LOW;
    }
}
