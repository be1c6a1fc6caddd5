package com.smartroute.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoutingPreferencesTest {

    @Test
    @DisplayName("defaults")
    void defaults() {
        var prefs = RoutingPreferences.defaults();
        assertEquals(PrivacyMode.BALANCED, prefs.privacyMode());
        assertEquals(0.5, prefs.costPriority());
        assertEquals(0.6, prefs.qualityThreshold());
        assertTrue(prefs.anonymizationEnabled());
        assertEquals(1.0, prefs.maxCloudCostPerRequest());
    }

    @Test
    @DisplayName("overrides accept numbers, strings and booleans")
    void overrides() {
        var prefs = RoutingPreferences.defaults().withOverrides(Map.of(
                RoutingPreferences.PRIVACY_MODE, "strict",
                RoutingPreferences.COST_PRIORITY, 0.9,
                RoutingPreferences.QUALITY_THRESHOLD, "0.75",
                RoutingPreferences.ANONYMIZATION_ENABLED, "false",
                RoutingPreferences.MAX_CLOUD_COST_PER_REQUEST, 2));
        assertEquals(PrivacyMode.STRICT, prefs.privacyMode());
        assertEquals(0.9, prefs.costPriority());
        assertEquals(0.75, prefs.qualityThreshold());
        assertFalse(prefs.anonymizationEnabled());
        assertEquals(2.0, prefs.maxCloudCostPerRequest());
    }

    @Test
    @DisplayName("malformed and unknown values keep the current settings")
    void malformed() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put(RoutingPreferences.PRIVACY_MODE, "paranoid");
        overrides.put(RoutingPreferences.COST_PRIORITY, "cheap");
        overrides.put(RoutingPreferences.ANONYMIZATION_ENABLED, "maybe");
        overrides.put(RoutingPreferences.QUALITY_THRESHOLD, null);
        overrides.put("temperature", 0.2);

        assertEquals(RoutingPreferences.defaults(), RoutingPreferences.defaults().withOverrides(overrides));
    }

    @Test
    @DisplayName("NaN is malformed and keeps the current settings")
    void notANumber() {
        var prefs = RoutingPreferences.defaults().withOverrides(Map.of(
                RoutingPreferences.MAX_CLOUD_COST_PER_REQUEST, "NaN",
                RoutingPreferences.COST_PRIORITY, Double.NaN));
        assertEquals(1.0, prefs.maxCloudCostPerRequest());
        assertEquals(0.5, prefs.costPriority());

        assertEquals(0.0, new RoutingPreferences(null, 0.5, 0.6, true, Double.NaN).maxCloudCostPerRequest());
    }

    @Test
    @DisplayName("out-of-range values are clamped")
    void clamped() {
        var prefs = new RoutingPreferences(null, 1.5, -0.2, true, -3);
        assertEquals(PrivacyMode.BALANCED, prefs.privacyMode());
        assertEquals(1.0, prefs.costPriority());
        assertEquals(0.0, prefs.qualityThreshold());
        assertEquals(0.0, prefs.maxCloudCostPerRequest());
    }

    @Test
    @DisplayName("request normalizes missing fields")
    void requestDefaults() {
        var request = new RoutingRequest("REQ-1", null, "  ", null);
        assertEquals("", request.content());
        assertEquals(RoutingRequest.DEFAULT_TASK_TYPE, request.taskType());
        assertTrue(request.preferences().isEmpty());
        assertThrows(NullPointerException.class, () -> new RoutingRequest(null, "x", "general"));
    }
}
