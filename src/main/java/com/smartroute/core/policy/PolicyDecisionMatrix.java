package com.smartroute.core.policy;

import com.smartroute.core.model.CapabilityAssessment;
import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.CostEstimate;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.RoutingPreferences;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import com.smartroute.core.model.SensitivityReport;
import com.smartroute.core.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Combines sensitivity, capability and cost into a {@link RoutingDecision}.
 * <p>
 * Privacy dominates: HIGH sensitivity always yields LOCAL_ONLY or LOCAL_FORCED
 * with no fallbacks. For other levels the overrides apply in order: cost
 * priority, simple-task locality, venue admission by privacy mode, then the
 * per-request cloud cost cap.
 */
public class PolicyDecisionMatrix {

    private static final Logger log = LoggerFactory.getLogger(PolicyDecisionMatrix.class);

    static final double COST_PRIORITY_OVERRIDE = 0.7;
    static final int MAX_FALLBACKS = 2;

    private final DecisionTable table;

    public PolicyDecisionMatrix() {
        this(DecisionTable.defaults());
    }

    public PolicyDecisionMatrix(DecisionTable table) {
        this.table = table;
    }

    public RoutingDecision decide(String requestId, SensitivityReport sensitivity, CapabilityAssessment capability,
                                  CostEstimate cost, RoutingPreferences preferences) {
        SensitivityLevel level = sensitivity.level();
        ComplexityClass complexity = capability.complexity();
        CapabilityTier tier = capability.tier();
        var reasons = new ArrayList<String>();

        RoutingStrategy strategy = table.lookup(level, complexity, tier).orElse(null);
        if (strategy == null) {
            strategy = table.mostConservative(level);
            log.warn("No decision entry for ({}, {}, {}); using most conservative {}", level, complexity, tier, strategy);
            reasons.add("no table entry, defaulted to most conservative strategy");
        }
        reasons.add("sensitivity " + level + (sensitivity.failedClosed() ? " (fail-closed)" : ""));
        reasons.add(String.format("complexity %s, local capability %s (%.2f)", complexity, tier, capability.score()));

        List<Venue> fallbacks;
        if (level == SensitivityLevel.HIGH) {
            if (!strategy.isLocalStrict()) {
                strategy = RoutingStrategy.LOCAL_FORCED;
            }
            reasons.add("sensitive content must stay local");
            fallbacks = List.of();
        } else {
            strategy = applyOverrides(strategy, complexity, tier, preferences, reasons);
            Set<Venue> allowed = allowedVenues(level, preferences);
            if (!allowed.contains(venueFor(strategy))) {
                reasons.add(venueFor(strategy) + " not permitted in " + preferences.privacyMode() + " mode");
                strategy = RoutingStrategy.LOCAL_PREFERRED;
            }
            Venue primary = venueFor(strategy);
            if (primary.isRemote() && cost.costOf(primary) > preferences.maxCloudCostPerRequest()) {
                reasons.add(String.format("%s cost $%.6f exceeds cap $%.6f", primary,
                        cost.costOf(primary), preferences.maxCloudCostPerRequest()));
                strategy = RoutingStrategy.LOCAL_PREFERRED;
            }
            fallbacks = strategy.isLocalStrict() ? List.of() : fallbackChain(venueFor(strategy), allowed, cost, preferences);
        }

        Venue primary = venueFor(strategy);
        double costImpact = cost.costOf(primary);
        reasons.add("strategy " + strategy);
        reasons.add(String.format("estimated cost $%.6f vs baseline $%.6f", costImpact, cost.baselineCost()));

        var venueCosts = new EnumMap<Venue, Double>(Venue.class);
        cost.costs().forEach((venue, c) -> venueCosts.put(venue, c.totalCost()));

        return new RoutingDecision(requestId, strategy, primary, fallbacks,
                confidence(level, tier, complexity), strategy.privacyScore(), costImpact, cost.baselineCost(),
                cost.totalTokens(), venueCosts, level, complexity, tier, preferences, String.join("; ", reasons));
    }

    private static RoutingStrategy applyOverrides(RoutingStrategy strategy, ComplexityClass complexity,
                                                  CapabilityTier tier, RoutingPreferences preferences,
                                                  List<String> reasons) {
        RoutingStrategy result = strategy;
        if (preferences.costPriority() > COST_PRIORITY_OVERRIDE
                && result.isCloud()
                && tier.atLeast(CapabilityTier.MEDIUM)) {
            reasons.add("cost priority " + preferences.costPriority() + " favours local processing");
            result = RoutingStrategy.LOCAL_PREFERRED;
        }
        if (complexity == ComplexityClass.SIMPLE && tier == CapabilityTier.HIGH && !result.isLocal()) {
            reasons.add("simple task well within local capability");
            result = RoutingStrategy.LOCAL_PREFERRED;
        }
        return result;
    }

    /**
     * Venues a request of the given sensitivity may reach under the effective preferences.
     * HYBRID and CLOUD_DIRECT send raw content to the remote backend, so MEDIUM content
     * reaches them only in PERMISSIVE mode.
     */
    static Set<Venue> allowedVenues(SensitivityLevel level, RoutingPreferences preferences) {
        Set<Venue> allowed = switch (level) {
            case HIGH -> EnumSet.of(Venue.LOCAL);
            case MEDIUM -> switch (preferences.privacyMode()) {
                case STRICT, BALANCED -> EnumSet.of(Venue.LOCAL, Venue.CLOUD_ANONYMIZED);
                case PERMISSIVE -> EnumSet.allOf(Venue.class);
            };
            case LOW -> EnumSet.allOf(Venue.class);
        };
        if (!preferences.anonymizationEnabled()) {
            allowed.remove(Venue.CLOUD_ANONYMIZED);
        }
        return allowed;
    }

    static Venue venueFor(RoutingStrategy strategy) {
        return switch (strategy) {
            case LOCAL_ONLY, LOCAL_FORCED, LOCAL_PREFERRED -> Venue.LOCAL;
            case CLOUD_ANONYMIZED -> Venue.CLOUD_ANONYMIZED;
            case CLOUD_DIRECT -> Venue.CLOUD_DIRECT;
            case HYBRID -> Venue.HYBRID;
        };
    }

    private static List<Venue> fallbackChain(Venue primary, Set<Venue> allowed, CostEstimate cost,
                                             RoutingPreferences preferences) {
        return allowed.stream()
                .filter(v -> v != primary)
                .filter(v -> v.isLocal() || cost.costOf(v) <= preferences.maxCloudCostPerRequest())
                .sorted(Comparator.comparingDouble(Venue::privacyScore).reversed()
                        .thenComparingDouble(cost::costOf))
                .limit(MAX_FALLBACKS)
                .toList();
    }

    static double confidence(SensitivityLevel level, CapabilityTier tier, ComplexityClass complexity) {
        double privacy = switch (level) {
            case HIGH -> 0.9;
            case MEDIUM -> 0.7;
            case LOW -> 0.8;
        };
        double capability = switch (tier) {
            case HIGH -> 0.9;
            case MEDIUM -> 0.7;
            case LOW -> 0.5;
        };
        double complexityConfidence = switch (complexity) {
            case SIMPLE -> 0.9;
            case MEDIUM -> 0.7;
            case COMPLEX -> 0.6;
            case ULTRA_COMPLEX -> 0.5;
        };
        return privacy * 0.4 + capability * 0.4 + complexityConfidence * 0.2;
    }
}
