package com.smartroute.core.policy;

import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;

import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of a base strategy for every
 * (sensitivity, complexity, capability tier) combination.
 */
public final class DecisionTable {

    public record Key(SensitivityLevel sensitivity, ComplexityClass complexity, CapabilityTier tier) {}

    private final Map<Key, RoutingStrategy> entries;

    private DecisionTable(Map<Key, RoutingStrategy> entries) {
        this.entries = Map.copyOf(entries);
    }

    public static DecisionTable defaults() {
        var b = builder();
        for (ComplexityClass c : new ComplexityClass[]{ComplexityClass.COMPLEX, ComplexityClass.ULTRA_COMPLEX}) {
            b.put(SensitivityLevel.HIGH, c, CapabilityTier.HIGH, RoutingStrategy.LOCAL_ONLY)
             .put(SensitivityLevel.HIGH, c, CapabilityTier.MEDIUM, RoutingStrategy.LOCAL_FORCED)
             .put(SensitivityLevel.HIGH, c, CapabilityTier.LOW, RoutingStrategy.LOCAL_FORCED)
             .put(SensitivityLevel.MEDIUM, c, CapabilityTier.HIGH, RoutingStrategy.LOCAL_PREFERRED)
             .put(SensitivityLevel.MEDIUM, c, CapabilityTier.MEDIUM, RoutingStrategy.CLOUD_ANONYMIZED)
             .put(SensitivityLevel.MEDIUM, c, CapabilityTier.LOW, RoutingStrategy.CLOUD_ANONYMIZED)
             .put(SensitivityLevel.LOW, c, CapabilityTier.HIGH, RoutingStrategy.HYBRID)
             .put(SensitivityLevel.LOW, c, CapabilityTier.MEDIUM, RoutingStrategy.CLOUD_DIRECT)
             .put(SensitivityLevel.LOW, c, CapabilityTier.LOW, RoutingStrategy.CLOUD_DIRECT);
        }
        return b
                .put(SensitivityLevel.HIGH, ComplexityClass.SIMPLE, CapabilityTier.HIGH, RoutingStrategy.LOCAL_ONLY)
                .put(SensitivityLevel.HIGH, ComplexityClass.SIMPLE, CapabilityTier.MEDIUM, RoutingStrategy.LOCAL_ONLY)
                .put(SensitivityLevel.HIGH, ComplexityClass.SIMPLE, CapabilityTier.LOW, RoutingStrategy.LOCAL_FORCED)
                .put(SensitivityLevel.HIGH, ComplexityClass.MEDIUM, CapabilityTier.HIGH, RoutingStrategy.LOCAL_ONLY)
                .put(SensitivityLevel.HIGH, ComplexityClass.MEDIUM, CapabilityTier.MEDIUM, RoutingStrategy.LOCAL_FORCED)
                .put(SensitivityLevel.HIGH, ComplexityClass.MEDIUM, CapabilityTier.LOW, RoutingStrategy.LOCAL_FORCED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.SIMPLE, CapabilityTier.HIGH, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.SIMPLE, CapabilityTier.MEDIUM, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.SIMPLE, CapabilityTier.LOW, RoutingStrategy.CLOUD_ANONYMIZED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.MEDIUM, CapabilityTier.HIGH, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.MEDIUM, CapabilityTier.MEDIUM, RoutingStrategy.CLOUD_ANONYMIZED)
                .put(SensitivityLevel.MEDIUM, ComplexityClass.MEDIUM, CapabilityTier.LOW, RoutingStrategy.CLOUD_ANONYMIZED)
                .put(SensitivityLevel.LOW, ComplexityClass.SIMPLE, CapabilityTier.HIGH, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.LOW, ComplexityClass.SIMPLE, CapabilityTier.MEDIUM, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.LOW, ComplexityClass.SIMPLE, CapabilityTier.LOW, RoutingStrategy.CLOUD_DIRECT)
                .put(SensitivityLevel.LOW, ComplexityClass.MEDIUM, CapabilityTier.HIGH, RoutingStrategy.LOCAL_PREFERRED)
                .put(SensitivityLevel.LOW, ComplexityClass.MEDIUM, CapabilityTier.MEDIUM, RoutingStrategy.CLOUD_DIRECT)
                .put(SensitivityLevel.LOW, ComplexityClass.MEDIUM, CapabilityTier.LOW, RoutingStrategy.CLOUD_DIRECT)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<RoutingStrategy> lookup(SensitivityLevel sensitivity, ComplexityClass complexity,
                                            CapabilityTier tier) {
        return Optional.ofNullable(entries.get(new Key(sensitivity, complexity, tier)));
    }

    /**
     * The most private strategy mapped for a sensitivity level, used when a
     * combination has no entry. Ties go to the strategy declared first in
     * {@link RoutingStrategy}. Levels with no entries fall back to a local strategy.
     */
    public RoutingStrategy mostConservative(SensitivityLevel sensitivity) {
        return entries.entrySet().stream()
                .filter(e -> e.getKey().sensitivity() == sensitivity)
                .map(Map.Entry::getValue)
                .max(Comparator.comparingDouble(RoutingStrategy::privacyScore)
                        .thenComparingInt(s -> -s.ordinal()))
                .orElse(sensitivity == SensitivityLevel.HIGH
                        ? RoutingStrategy.LOCAL_ONLY
                        : RoutingStrategy.LOCAL_PREFERRED);
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {
        private final Map<Key, RoutingStrategy> entries = new HashMap<>();

        public Builder put(SensitivityLevel sensitivity, ComplexityClass complexity, CapabilityTier tier,
                           RoutingStrategy strategy) {
            entries.put(new Key(sensitivity, complexity, tier), strategy);
            return this;
        }

        public DecisionTable build() {
            return new DecisionTable(entries);
        }
    }
}
