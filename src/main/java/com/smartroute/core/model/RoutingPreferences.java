package com.smartroute.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Effective routing policy for one request: the configured defaults with any
 * per-request overrides applied.
 *
 * @param privacyMode             which remote venues MEDIUM content may reach
 * @param costPriority            0 = quality first, 1 = cost first
 * @param qualityThreshold        minimum acceptable backend quality score
 * @param anonymizationEnabled    whether the CLOUD_ANONYMIZED venue may be used
 * @param maxCloudCostPerRequest  remote venues estimated above this cost are excluded
 */
public record RoutingPreferences(
    PrivacyMode privacyMode,
    double costPriority,
    double qualityThreshold,
    boolean anonymizationEnabled,
    double maxCloudCostPerRequest
) {

    private static final Logger log = LoggerFactory.getLogger(RoutingPreferences.class);

    public static final String PRIVACY_MODE = "privacy_mode";
    public static final String COST_PRIORITY = "cost_priority";
    public static final String QUALITY_THRESHOLD = "quality_threshold";
    public static final String ANONYMIZATION_ENABLED = "anonymization_enabled";
    public static final String MAX_CLOUD_COST_PER_REQUEST = "max_cloud_cost_per_request";

    public RoutingPreferences {
        if (privacyMode == null) {
            privacyMode = PrivacyMode.BALANCED;
        }
        costPriority = clamp01(costPriority);
        qualityThreshold = clamp01(qualityThreshold);
        if (Double.isNaN(maxCloudCostPerRequest) || maxCloudCostPerRequest < 0) {
            maxCloudCostPerRequest = 0;
        }
    }

    public static RoutingPreferences defaults() {
        return new RoutingPreferences(PrivacyMode.BALANCED, 0.5, 0.6, true, 1.0);
    }

    /**
     * Applies per-request overrides. Unknown keys are ignored; malformed values
     * are logged and the current value is kept.
     */
    public RoutingPreferences withOverrides(Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        PrivacyMode mode = privacyMode;
        double cost = costPriority;
        double quality = qualityThreshold;
        boolean anonymize = anonymizationEnabled;
        double maxCost = maxCloudCostPerRequest;

        for (var entry : overrides.entrySet()) {
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            try {
                switch (entry.getKey()) {
                    case PRIVACY_MODE -> mode = PrivacyMode.parse(value.toString());
                    case COST_PRIORITY -> cost = toDouble(value);
                    case QUALITY_THRESHOLD -> quality = toDouble(value);
                    case ANONYMIZATION_ENABLED -> anonymize = toBoolean(value);
                    case MAX_CLOUD_COST_PER_REQUEST -> maxCost = toDouble(value);
                    default -> log.debug("Ignoring unknown preference '{}'", entry.getKey());
                }
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring malformed preference {}={}: {}", entry.getKey(), value, e.getMessage());
            }
        }
        return new RoutingPreferences(mode, cost, quality, anonymize, maxCost);
    }

    private static double toDouble(Object value) {
        double parsed = value instanceof Number number
                ? number.doubleValue()
                : Double.parseDouble(value.toString().trim());
        if (Double.isNaN(parsed)) {
            throw new IllegalArgumentException("not a number");
        }
        return parsed;
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("not a boolean: " + text);
    }

    private static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
