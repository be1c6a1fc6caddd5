package com.smartroute.core.cost;

import com.smartroute.core.model.Venue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable pricing for every venue, plus the parameters that derive output
 * tokens and the hybrid split.
 * <p>
 * LOCAL has only a fixed per-call amount: energy and hardware depreciation
 * per hour, amortized over the assumed processing time of one call.
 */
public final class PricingTable {

    /** Used for any remote venue with no configured price. */
    public static final VenuePricing DEFAULT_REMOTE = new VenuePricing(0.003, 0.015, 0.0);

    private final Map<Venue, VenuePricing> prices;
    private final double hybridCloudShare;
    private final double outputMultiplier;

    public PricingTable(Map<Venue, VenuePricing> prices, double hybridCloudShare, double outputMultiplier) {
        if (hybridCloudShare < 0 || hybridCloudShare > 1) {
            throw new IllegalArgumentException("hybridCloudShare must be in [0,1]");
        }
        if (outputMultiplier < 1.5 || outputMultiplier > 2.0) {
            throw new IllegalArgumentException("outputMultiplier must be in [1.5,2.0]");
        }
        this.prices = prices.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(prices));
        this.hybridCloudShare = hybridCloudShare;
        this.outputMultiplier = outputMultiplier;
    }

    public static PricingTable defaults() {
        var prices = new EnumMap<Venue, VenuePricing>(Venue.class);
        prices.put(Venue.LOCAL, new VenuePricing(0, 0, localFixedCost(0.12, 0.05, 2.0)));
        prices.put(Venue.CLOUD_DIRECT, new VenuePricing(0.03, 0.06, 0.0));
        prices.put(Venue.CLOUD_ANONYMIZED, new VenuePricing(0.03, 0.06, 0.0001));
        return new PricingTable(prices, 0.3, 1.5);
    }

    /**
     * Per-call cost of the local venue.
     *
     * @param electricityPerHour  energy cost per hour of inference
     * @param depreciationPerHour hardware depreciation per hour
     * @param secondsPerCall      assumed processing time of one call
     */
    public static double localFixedCost(double electricityPerHour, double depreciationPerHour,
                                         double secondsPerCall) {
        return (electricityPerHour + depreciationPerHour) * secondsPerCall / 3600.0;
    }

    /**
     * Configured price of a venue. HYBRID is derived, so it never has an entry.
     */
    public Optional<VenuePricing> pricing(Venue venue) {
        return Optional.ofNullable(prices.get(venue));
    }

    public double hybridCloudShare() {
        return hybridCloudShare;
    }

    public double outputMultiplier() {
        return outputMultiplier;
    }
}
