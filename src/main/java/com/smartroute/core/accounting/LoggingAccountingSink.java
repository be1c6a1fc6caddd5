package com.smartroute.core.accounting;

import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one line per recorded execution to the {@code smartroute.accounting} logger.
 */
public class LoggingAccountingSink implements AccountingSink {

    private static final Logger log = LoggerFactory.getLogger("smartroute.accounting");

    @Override
    public void accept(RoutingDecision decision, ExecutionResult result) {
        if (result.isSuccess()) {
            log.info("request={} strategy={} venue={} cost={} saved={} latencyMs={} quality={}",
                    result.requestId(), decision.strategy(), result.venueUsed(),
                    String.format("%.6f", result.actualCost()),
                    String.format("%.6f", decision.baselineCost() - result.actualCost()),
                    result.latencyMs(), String.format("%.2f", result.qualityScore()));
        } else {
            log.info("request={} strategy={} error={} attempts={} latencyMs={}",
                    result.requestId(), decision.strategy(), result.error(),
                    result.attempts().size(), result.latencyMs());
        }
    }
}
