package com.smartroute.core.cost;

import com.smartroute.core.model.RoutingException;
import com.smartroute.core.model.Venue;

/**
 * No price is configured for a venue. The cost model recovers with the
 * default per-token table.
 */
public class CostDataMissingException extends RoutingException {

    public CostDataMissingException(Venue venue) {
        super("No pricing configured for venue " + venue);
    }
}
