package com.smartroute.core.health;

import com.smartroute.core.model.Venue;

import java.util.Collection;
import java.util.Map;

/**
 * Health of one routing component, either a venue backend or the accounting
 * ledger. Metadata values are serialized as-is, so counts stay numeric.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, Object> metadata
) {
    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static String componentName(Venue venue) {
        return "venue." + venue.name().toLowerCase();
    }

    public static HealthStatus venueUp(Venue venue, String backendName) {
        return new HealthStatus(componentName(venue), Status.UP, "Backend registered (" + backendName + ")",
                Map.of("backend", backendName, "privacy_score", venue.privacyScore()));
    }

    /**
     * Sensitive requests cannot be served without the local venue, so its absence
     * is DOWN. A missing remote venue only narrows the fallback chain.
     */
    public static HealthStatus venueMissing(Venue venue) {
        return new HealthStatus(componentName(venue), venue.isLocal() ? Status.DOWN : Status.DEGRADED,
                "No backend registered", Map.of("privacy_score", venue.privacyScore()));
    }

    /**
     * Worst status among {@code checks}; UP when there are none.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
