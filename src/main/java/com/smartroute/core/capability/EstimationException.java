package com.smartroute.core.capability;

import com.smartroute.core.model.RoutingException;

/**
 * No capability data exists for a task type.
 */
public class EstimationException extends RoutingException {

    public EstimationException(String message) {
        super(message);
    }
}
