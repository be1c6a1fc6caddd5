package com.smartroute.core.model;

/**
 * Privacy risk of a piece of content.
 * <ul>
 *   <li>{@code HIGH} - secrets or personal data; must never leave the local venue</li>
 *   <li>{@code MEDIUM} - business or infrastructure details; remote only when anonymized</li>
 *   <li>{@code LOW} - nothing sensitive detected</li>
 * </ul>
 */
public enum SensitivityLevel {
    HIGH,
    MEDIUM,
    LOW
}
