package com.smartroute.core.capability;

import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link CapabilityEstimator} and {@link CapabilityTable}.
 */
class CapabilityEstimatorTest {

    private final CapabilityEstimator estimator = new CapabilityEstimator();

    @Nested
    @DisplayName("known task types")
    class KnownTaskTypes {

        @Test
        @DisplayName("simple syntax check is HIGH tier with score clamped to 1")
        void syntaxCheckingIsHigh() {
            var result = estimator.estimate("syntax_checking", "def hello(): print('hi')");
            assertEquals(ComplexityClass.SIMPLE, result.complexity());
            assertEquals(1.0, result.score(), 1e-9);
            assertEquals(CapabilityTier.HIGH, result.tier());
            assertEquals(2_000, result.estimatedLatencyMs());
            assertTrue(result.knownTaskType());
        }

        @Test
        @DisplayName("architecture design is LOW tier")
        void architectureDesignIsLow() {
            var result = estimator.estimate("architecture_design",
                    "Design a microservices architecture for e-commerce platform");
            assertEquals(ComplexityClass.COMPLEX, result.complexity());
            assertEquals(0.245, result.score(), 1e-9);
            assertEquals(CapabilityTier.LOW, result.tier());
            assertEquals(Math.round(15_000 * (2.0 - 0.245)), result.estimatedLatencyMs());
        }

        @Test
        @DisplayName("content can raise the table's complexity class")
        void contentRaisesComplexity() {
            var result = estimator.estimate("syntax_checking", "Design a caching layer");
            assertEquals(ComplexityClass.COMPLEX, result.complexity());
            assertEquals(0.95 * 0.7, result.score(), 1e-9);
            assertEquals(CapabilityTier.MEDIUM, result.tier());
        }

        @Test
        @DisplayName("aliases resolve to the canonical task type")
        void aliasesResolve() {
            var result = estimator.estimate("code_generation", "");
            assertTrue(result.knownTaskType());
            assertEquals(ComplexityClass.MEDIUM, result.complexity());
            assertEquals(0.70, result.score(), 1e-9);
        }

        @Test
        @DisplayName("task type lookup ignores case and whitespace")
        void lookupIsNormalized() {
            assertTrue(estimator.estimate("  Syntax_Checking ", "").knownTaskType());
        }
    }

    @Nested
    @DisplayName("unknown task types")
    class UnknownTaskTypes {

        @Test
        @DisplayName("fall back to a 0.5 base score with inferred complexity")
        void inferredComplexity() {
            var result = estimator.estimate("translation", "fix it");
            assertFalse(result.knownTaskType());
            assertEquals(ComplexityClass.SIMPLE, result.complexity());
            assertEquals(0.6, result.score(), 1e-9);
            assertEquals(CapabilityTier.MEDIUM, result.tier());
        }

        @Test
        @DisplayName("blank content falls back to MEDIUM")
        void blankContentIsMedium() {
            var result = estimator.estimate("translation", "   ");
            assertEquals(ComplexityClass.MEDIUM, result.complexity());
            assertEquals(0.5, result.score(), 1e-9);
            assertEquals(CapabilityTier.LOW, result.tier());
        }
    }

    @Test
    @DisplayName("a failing analyzer is treated as MEDIUM complexity")
    void failingAnalyzer() {
        ComplexityAnalyzer analyzer = mock(ComplexityAnalyzer.class);
        when(analyzer.analyze(anyString())).thenThrow(new IllegalStateException("bad regex"));
        var result = new CapabilityEstimator(CapabilityTable.defaults(), analyzer)
                .estimate("syntax_checking", "anything");
        assertEquals(ComplexityClass.MEDIUM, result.complexity());
        assertEquals(0.95, result.score(), 1e-9);
    }

    @Test
    @DisplayName("configured entries override the defaults")
    void configuredEntries() {
        var table = CapabilityTable.defaults().withEntries(Map.of(
                "translation", new CapabilityTable.Entry(ComplexityClass.SIMPLE, 0.9)));
        var result = new CapabilityEstimator(table, new ComplexityAnalyzer()).estimate("translation", "");
        assertTrue(result.knownTaskType());
        assertEquals(1.0, result.score(), 1e-9);
    }

    @Test
    @DisplayName("table rejects base scores outside [0,1]")
    void tableRejectsBadScores() {
        assertThrows(IllegalArgumentException.class,
                () -> CapabilityTable.builder().put("x", ComplexityClass.SIMPLE, 1.5));
    }

    @Test
    @DisplayName("require throws for unknown task types")
    void requireThrows() {
        assertThrows(EstimationException.class, () -> CapabilityTable.defaults().require("poetry"));
        assertFalse(CapabilityTable.defaults().contains("poetry"));
    }

    @Test
    @DisplayName("multipliers decrease with complexity")
    void multipliersDecrease() {
        assertTrue(CapabilityEstimator.multiplier(ComplexityClass.SIMPLE)
                > CapabilityEstimator.multiplier(ComplexityClass.MEDIUM));
        assertTrue(CapabilityEstimator.multiplier(ComplexityClass.COMPLEX)
                > CapabilityEstimator.multiplier(ComplexityClass.ULTRA_COMPLEX));
    }
}
