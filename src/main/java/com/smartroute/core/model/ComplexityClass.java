package com.smartroute.core.model;

/**
 * Task complexity, ordered from least to most demanding.
 */
public enum ComplexityClass {
    SIMPLE,
    MEDIUM,
    COMPLEX,
    ULTRA_COMPLEX;

    /**
     * Returns whichever of the two classes is more demanding.
     */
    public static ComplexityClass max(ComplexityClass a, ComplexityClass b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }
}
