package com.smartroute.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Where a request should run. Created once per request and never modified.
 *
 * @param requestId     the routed request
 * @param strategy      strategy chosen after overrides
 * @param primaryVenue  first venue to try
 * @param fallbackChain up to two alternates, in the order they will be tried
 * @param confidence    blended confidence in [0,1]
 * @param privacyScore  privacy protection of the chosen strategy in [0,1]
 * @param costImpact    estimated cost of the primary venue
 * @param baselineCost  estimated cost of the most expensive remote venue
 * @param estimatedTokens estimated input plus output tokens
 * @param venueCosts    estimated total cost per venue
 * @param sensitivity   classified sensitivity level
 * @param complexity    resolved complexity class
 * @param tier          local capability tier
 * @param preferences   effective preferences the decision was made under
 * @param reasoning     diagnostic explanation; not used for control flow
 */
public record RoutingDecision(
    String requestId,
    RoutingStrategy strategy,
    Venue primaryVenue,
    List<Venue> fallbackChain,
    double confidence,
    double privacyScore,
    double costImpact,
    double baselineCost,
    int estimatedTokens,
    Map<Venue, Double> venueCosts,
    SensitivityLevel sensitivity,
    ComplexityClass complexity,
    CapabilityTier tier,
    RoutingPreferences preferences,
    String reasoning
) {

    public RoutingDecision {
        fallbackChain = fallbackChain == null ? List.of() : List.copyOf(fallbackChain);
        venueCosts = venueCosts == null || venueCosts.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(venueCosts));
    }

    /**
     * The primary venue followed by the fallback chain.
     */
    public List<Venue> chain() {
        var chain = new ArrayList<Venue>(fallbackChain.size() + 1);
        chain.add(primaryVenue);
        chain.addAll(fallbackChain);
        return chain;
    }

    public double costOf(Venue venue) {
        return venueCosts.getOrDefault(venue, 0.0);
    }

    public double estimatedSavings() {
        return baselineCost - costImpact;
    }
}
