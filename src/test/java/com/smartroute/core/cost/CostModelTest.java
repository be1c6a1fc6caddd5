package com.smartroute.core.cost;

import com.smartroute.core.model.Venue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CostModel}, {@link PricingTable} and {@link TokenEstimator}.
 */
class CostModelTest {

    private static final double LOCAL_FIXED = (0.12 + 0.05) * 2.0 / 3600.0;

    private final CostModel model = new CostModel();

    @Nested
    @DisplayName("token estimation")
    class Tokens {

        @Test
        @DisplayName("latin text is about four characters per token")
        void latin() {
            assertEquals(100, TokenEstimator.inputTokens("a".repeat(400)));
        }

        @Test
        @DisplayName("CJK text is about one and a half characters per token")
        void cjk() {
            assertEquals(4, TokenEstimator.inputTokens("中文中文中文"));
        }

        @Test
        @DisplayName("empty content has no tokens")
        void empty() {
            assertEquals(0, TokenEstimator.inputTokens(""));
            assertEquals(0, TokenEstimator.inputTokens(null));
        }

        @Test
        @DisplayName("output tokens scale by the multiplier")
        void output() {
            assertEquals(150, TokenEstimator.outputTokens(100, 1.5));
            assertEquals(200, TokenEstimator.outputTokens(100, 2.0));
        }
    }

    @Nested
    @DisplayName("venue costs")
    class VenueCosts {

        @Test
        @DisplayName("per-venue totals for 100 input tokens")
        void totals() {
            var estimate = model.estimate("a".repeat(400));
            assertEquals(100, estimate.inputTokens());
            assertEquals(150, estimate.outputTokens());
            assertEquals(250, estimate.totalTokens());

            assertEquals(LOCAL_FIXED, estimate.costOf(Venue.LOCAL), 1e-12);
            assertEquals(0.012, estimate.costOf(Venue.CLOUD_DIRECT), 1e-12);
            assertEquals(0.0121, estimate.costOf(Venue.CLOUD_ANONYMIZED), 1e-12);
            assertEquals(LOCAL_FIXED + 0.3 * 0.012, estimate.costOf(Venue.HYBRID), 1e-12);
            assertFalse(estimate.usedDefaultPricing());
        }

        @Test
        @DisplayName("baseline is the most expensive remote venue")
        void baseline() {
            var estimate = model.estimate("a".repeat(400));
            assertEquals(Venue.CLOUD_ANONYMIZED, estimate.baselineVenue());
            assertEquals(0.0121, estimate.baselineCost(), 1e-12);
            assertTrue(estimate.savings(Venue.LOCAL) > 0);
            assertEquals(0.0, estimate.savings(Venue.CLOUD_ANONYMIZED), 1e-12);
        }

        @Test
        @DisplayName("local-only candidates compare against a direct cloud call")
        void localOnlyBaseline() {
            var estimate = model.estimate("a".repeat(400), EnumSet.of(Venue.LOCAL));
            assertEquals(1, estimate.costs().size());
            assertEquals(Venue.CLOUD_DIRECT, estimate.baselineVenue());
            assertEquals(0.012, estimate.baselineCost(), 1e-12);
        }

        @Test
        @DisplayName("local cost does not depend on content length")
        void localIsFixed() {
            assertEquals(model.estimate("short").costOf(Venue.LOCAL),
                    model.estimate("x".repeat(10_000)).costOf(Venue.LOCAL), 1e-15);
        }

        @Test
        @DisplayName("costs never decrease as token counts grow")
        void monotonic() {
            for (Venue venue : Venue.values()) {
                double previous = -1;
                for (int tokens = 0; tokens <= 5_000; tokens += 500) {
                    double cost = model.cost(venue, tokens, tokens * 2).totalCost();
                    assertTrue(cost >= previous, venue + " cost decreased at " + tokens + " tokens");
                    previous = cost;
                }
            }
        }
    }

    @Test
    @DisplayName("missing remote pricing falls back to the default table")
    void missingPricing() {
        var table = new PricingTable(Map.of(Venue.LOCAL, new VenuePricing(0, 0, 0.001)), 0.3, 1.5);
        var estimate = new CostModel(table).estimate("a".repeat(4_000));
        assertTrue(estimate.usedDefaultPricing());
        double expected = PricingTable.DEFAULT_REMOTE.variableCost(1_000, 1_500);
        assertEquals(expected, estimate.costOf(Venue.CLOUD_DIRECT), 1e-12);
        assertEquals(0.001, estimate.costOf(Venue.LOCAL), 1e-12);
    }

    @Test
    @DisplayName("pricing table validates its parameters")
    void pricingValidation() {
        assertThrows(IllegalArgumentException.class, () -> new PricingTable(Map.of(), 1.5, 1.5));
        assertThrows(IllegalArgumentException.class, () -> new PricingTable(Map.of(), 0.3, 3.0));
        assertThrows(IllegalArgumentException.class, () -> new VenuePricing(-1, 0, 0));
    }

    @Test
    @DisplayName("local fixed cost amortizes hourly cost over the call time")
    void localFixedCost() {
        assertEquals(LOCAL_FIXED, PricingTable.localFixedCost(0.12, 0.05, 2.0), 1e-15);
        assertTrue(PricingTable.defaults().pricing(Venue.HYBRID).isEmpty());
    }
}
