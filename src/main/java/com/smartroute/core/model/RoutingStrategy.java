package com.smartroute.core.model;

/**
 * Routing strategy chosen by the decision matrix.
 * <ul>
 *   <li>{@code LOCAL_ONLY} - local, no alternatives considered</li>
 *   <li>{@code LOCAL_FORCED} - local even though capability is poor, because privacy requires it</li>
 *   <li>{@code LOCAL_PREFERRED} - local first, remote venues allowed as fallbacks</li>
 *   <li>{@code CLOUD_ANONYMIZED} - remote with placeholders substituted</li>
 *   <li>{@code CLOUD_DIRECT} - remote with raw content</li>
 *   <li>{@code HYBRID} - split between local and remote</li>
 * </ul>
 */
public enum RoutingStrategy {
    LOCAL_ONLY(1.0),
    LOCAL_FORCED(1.0),
    LOCAL_PREFERRED(0.9),
    CLOUD_ANONYMIZED(0.7),
    CLOUD_DIRECT(0.3),
    HYBRID(0.6);

    private final double privacyScore;

    RoutingStrategy(double privacyScore) {
        this.privacyScore = privacyScore;
    }

    public double privacyScore() {
        return privacyScore;
    }

    public boolean isLocal() {
        return this == LOCAL_ONLY || this == LOCAL_FORCED || this == LOCAL_PREFERRED;
    }

    /** Strategies that never permit a fallback to another venue. */
    public boolean isLocalStrict() {
        return this == LOCAL_ONLY || this == LOCAL_FORCED;
    }

    public boolean isCloud() {
        return this == CLOUD_ANONYMIZED || this == CLOUD_DIRECT;
    }
}
