package com.smartroute.core.accounting;

import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;

/**
 * Receives every recorded execution after the in-memory counters are updated,
 * for example to persist them. Called outside the accounting lock; failures
 * are logged and do not affect accounting.
 */
@FunctionalInterface
public interface AccountingSink {

    void accept(RoutingDecision decision, ExecutionResult result);
}
