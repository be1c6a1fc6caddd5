package com.smartroute.core.policy;

import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTableTest {

    private final DecisionTable table = DecisionTable.defaults();

    @Test
    @DisplayName("every combination has an entry")
    void complete() {
        assertEquals(SensitivityLevel.values().length * ComplexityClass.values().length
                * CapabilityTier.values().length, table.size());
    }

    @Test
    @DisplayName("high sensitivity maps only to local strategies")
    void highIsLocal() {
        for (ComplexityClass complexity : ComplexityClass.values()) {
            for (CapabilityTier tier : CapabilityTier.values()) {
                assertTrue(table.lookup(SensitivityLevel.HIGH, complexity, tier).orElseThrow().isLocalStrict());
            }
        }
    }

    @Test
    @DisplayName("ultra complex mirrors complex")
    void ultraMirrorsComplex() {
        for (SensitivityLevel level : SensitivityLevel.values()) {
            for (CapabilityTier tier : CapabilityTier.values()) {
                assertEquals(table.lookup(level, ComplexityClass.COMPLEX, tier),
                        table.lookup(level, ComplexityClass.ULTRA_COMPLEX, tier));
            }
        }
    }

    @Test
    @DisplayName("most conservative strategy per level")
    void mostConservative() {
        assertEquals(RoutingStrategy.LOCAL_ONLY, table.mostConservative(SensitivityLevel.HIGH));
        assertEquals(RoutingStrategy.LOCAL_PREFERRED, table.mostConservative(SensitivityLevel.MEDIUM));
        assertEquals(RoutingStrategy.LOCAL_PREFERRED, table.mostConservative(SensitivityLevel.LOW));
    }

    @Test
    @DisplayName("empty table falls back to local strategies")
    void emptyTable() {
        var empty = DecisionTable.builder().build();
        assertTrue(empty.lookup(SensitivityLevel.LOW, ComplexityClass.SIMPLE, CapabilityTier.HIGH).isEmpty());
        assertEquals(RoutingStrategy.LOCAL_ONLY, empty.mostConservative(SensitivityLevel.HIGH));
        assertEquals(RoutingStrategy.LOCAL_PREFERRED, empty.mostConservative(SensitivityLevel.LOW));
    }
}
