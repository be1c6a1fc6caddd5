package com.smartroute.core.model;

import java.util.Locale;

/**
 * Operator-selected privacy posture. Controls which remote venues a
 * MEDIUM-sensitivity request may reach.
 */
public enum PrivacyMode {
    STRICT,
    BALANCED,
    PERMISSIVE;

    public static PrivacyMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
