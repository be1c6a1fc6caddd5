package com.smartroute.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.Venue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON view of a {@link RoutingDecision}.
 */
public record DecisionResponse(
    @JsonProperty("request_id") String requestId,
    String strategy,
    @JsonProperty("primary_venue") String primaryVenue,
    @JsonProperty("fallback_chain") List<String> fallbackChain,
    double confidence,
    @JsonProperty("privacy_score") double privacyScore,
    @JsonProperty("cost_impact") double costImpact,
    @JsonProperty("baseline_cost") double baselineCost,
    @JsonProperty("estimated_savings") double estimatedSavings,
    @JsonProperty("venue_costs") Map<String, Double> venueCosts,
    String sensitivity,
    String complexity,
    @JsonProperty("capability_tier") String capabilityTier,
    String reasoning
) {

    public static DecisionResponse from(RoutingDecision d) {
        Map<String, Double> costs = new LinkedHashMap<>();
        d.venueCosts().forEach((venue, cost) -> costs.put(venue.name(), cost));
        return new DecisionResponse(d.requestId(), d.strategy().name(), d.primaryVenue().name(),
                d.fallbackChain().stream().map(Venue::name).toList(), d.confidence(), d.privacyScore(),
                d.costImpact(), d.baselineCost(), d.estimatedSavings(), costs, d.sensitivity().name(),
                d.complexity().name(), d.tier().name(), d.reasoning());
    }
}
