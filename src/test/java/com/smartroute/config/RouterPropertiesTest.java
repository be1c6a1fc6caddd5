package com.smartroute.config;

import com.smartroute.core.model.PrivacyMode;
import com.smartroute.core.model.RoutingPreferences;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RouterPropertiesTest {

    @Test
    void routingDefaultsAreReasonable() {
        var props = new RouterProperties();
        RoutingPreferences prefs = props.getRouting().toPreferences();
        assertEquals(PrivacyMode.BALANCED, prefs.privacyMode());
        assertEquals(0.5, prefs.costPriority());
        assertEquals(0.6, prefs.qualityThreshold());
        assertTrue(prefs.anonymizationEnabled());
        assertEquals(1.0, prefs.maxCloudCostPerRequest());
    }

    @Test
    void executionAndAccountingDefaults() {
        var props = new RouterProperties();
        assertEquals(Duration.ofSeconds(30), props.getExecution().getAttemptTimeout());
        assertEquals(Duration.ofSeconds(90), props.getExecution().getOverallDeadline());
        assertEquals(Duration.ofHours(24), props.getAccounting().getWindow());
        assertEquals(10_000, props.getAccounting().getMaxWindowEntries());
        assertEquals(0.7, props.getClassifier().getRuleWeight());
        assertEquals(0.3, props.getClassifier().getHeuristicWeight());
    }

    @Test
    void backendsAreDisabledByDefault() {
        var backends = new RouterProperties().getBackends();
        assertFalse(backends.getLocal().isUsable());
        assertFalse(backends.getCloud().isUsable());
        assertTrue(backends.getHybrid().isEnabled());
        assertEquals(0.7, backends.getHybrid().getLocalShare());
    }

    @Test
    void backendNeedsUrlAndKeyToBeUsable() {
        var backend = new RouterProperties.Backend();
        backend.setEnabled(true);
        backend.setBaseUrl("https://api.example.com");
        assertFalse(backend.isUsable());

        backend.setApiKey("   ");
        assertFalse(backend.isUsable());

        backend.setApiKey("sk-test");
        assertTrue(backend.isUsable());
    }

    @Test
    void changedRoutingFlowsIntoPreferences() {
        var props = new RouterProperties();
        props.getRouting().setPrivacyMode(PrivacyMode.STRICT);
        props.getRouting().setCostPriority(0.9);

        RoutingPreferences prefs = props.getRouting().toPreferences();
        assertEquals(PrivacyMode.STRICT, prefs.privacyMode());
        assertEquals(0.9, prefs.costPriority());
    }
}
