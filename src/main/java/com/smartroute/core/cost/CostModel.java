package com.smartroute.core.cost;

import com.smartroute.core.model.CostEstimate;
import com.smartroute.core.model.Venue;
import com.smartroute.core.model.VenueCost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Estimates what a request would cost on each candidate venue.
 * <ul>
 *   <li>LOCAL: fixed per-call amount only</li>
 *   <li>CLOUD_DIRECT / CLOUD_ANONYMIZED: per-1K-token input and output prices plus any fixed fee</li>
 *   <li>HYBRID: the local fixed amount plus the cloud share of the CLOUD_DIRECT token cost</li>
 * </ul>
 * The baseline is the most expensive remote candidate; savings are measured against it.
 */
public class CostModel {

    private static final Logger log = LoggerFactory.getLogger(CostModel.class);

    private final PricingTable pricing;

    public CostModel() {
        this(PricingTable.defaults());
    }

    public CostModel(PricingTable pricing) {
        this.pricing = pricing;
    }

    public CostEstimate estimate(String content) {
        return estimate(content, EnumSet.allOf(Venue.class));
    }

    public CostEstimate estimate(String content, Collection<Venue> candidates) {
        int input = TokenEstimator.inputTokens(content);
        int output = TokenEstimator.outputTokens(input, pricing.outputMultiplier());

        var costs = new EnumMap<Venue, VenueCost>(Venue.class);
        boolean usedDefault = false;
        for (Venue venue : candidates) {
            Priced priced = costFor(venue, input, output);
            costs.put(venue, priced.cost());
            usedDefault |= priced.usedDefault();
        }

        Venue baseline = null;
        double baselineCost = 0.0;
        for (Map.Entry<Venue, VenueCost> entry : costs.entrySet()) {
            if (entry.getKey().isRemote() && (baseline == null || entry.getValue().totalCost() > baselineCost)) {
                baseline = entry.getKey();
                baselineCost = entry.getValue().totalCost();
            }
        }
        if (baseline == null) {
            // No remote candidate: compare against what a direct cloud call would have cost.
            baseline = Venue.CLOUD_DIRECT;
            Priced direct = costFor(Venue.CLOUD_DIRECT, input, output);
            baselineCost = direct.cost().totalCost();
            usedDefault |= direct.usedDefault();
        }

        return new CostEstimate(input, output, costs, baseline, baselineCost, usedDefault);
    }

    /**
     * Cost of one venue for explicit token counts. Non-decreasing in both counts.
     */
    public VenueCost cost(Venue venue, int inputTokens, int outputTokens) {
        return costFor(venue, inputTokens, outputTokens).cost();
    }

    private record Priced(VenueCost cost, boolean usedDefault) {}

    private Priced costFor(Venue venue, int input, int output) {
        return switch (venue) {
            case LOCAL -> {
                VenuePricing local = pricing.pricing(Venue.LOCAL).orElse(null);
                if (local == null) {
                    log.warn("{}; assuming zero local cost", new CostDataMissingException(Venue.LOCAL).getMessage());
                    yield new Priced(VenueCost.of(0.0, 0.0), true);
                }
                yield new Priced(VenueCost.of(local.fixedPerCall(), 0.0), false);
            }
            case CLOUD_DIRECT, CLOUD_ANONYMIZED -> {
                Resolved remote = remotePricing(venue);
                yield new Priced(VenueCost.of(remote.pricing().fixedPerCall(),
                        remote.pricing().variableCost(input, output)), remote.usedDefault());
            }
            case HYBRID -> {
                double localFixed = pricing.pricing(Venue.LOCAL).map(VenuePricing::fixedPerCall).orElse(0.0);
                Resolved cloud = remotePricing(Venue.CLOUD_DIRECT);
                double variable = pricing.hybridCloudShare() * cloud.pricing().variableCost(input, output);
                yield new Priced(VenueCost.of(localFixed, variable), cloud.usedDefault());
            }
        };
    }

    private record Resolved(VenuePricing pricing, boolean usedDefault) {}

    private Resolved remotePricing(Venue venue) {
        return pricing.pricing(venue)
                .map(p -> new Resolved(p, false))
                .orElseGet(() -> {
                    log.warn("{}; using default per-token prices", new CostDataMissingException(venue).getMessage());
                    return new Resolved(PricingTable.DEFAULT_REMOTE, true);
                });
    }
}
