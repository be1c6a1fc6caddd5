package com.smartroute.core.metrics;

import com.smartroute.core.model.AttemptRecord;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing and execution.
 */
@Service
public class RouterMetrics {

    private final MeterRegistry registry;

    public RouterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(RoutingStrategy strategy, SensitivityLevel sensitivity) {
        Counter.builder("smartroute.route.decisions")
                .tag("strategy", strategy.name())
                .register(registry)
                .increment();
        Counter.builder("smartroute.sensitivity")
                .tag("level", sensitivity.name())
                .register(registry)
                .increment();
    }

    public void recordRouteDuration(long ms) {
        Timer.builder("smartroute.route.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one venue attempt.
     *
     * @param attempt the attempt; its outcome becomes the {@code outcome} tag
     */
    public void recordAttempt(AttemptRecord attempt) {
        Counter.builder("smartroute.execution.attempts")
                .description("Venue attempts by outcome")
                .tag("venue", attempt.venue().name())
                .tag("outcome", attempt.outcome().name().toLowerCase())
                .register(registry)
                .increment();
        Timer.builder("smartroute.execution.duration")
                .tag("venue", attempt.venue().name())
                .register(registry)
                .record(Duration.ofMillis(attempt.latencyMs()));
    }

    public void recordRequestResult(String status) {
        Counter.builder("smartroute.requests.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCostSaved(double usd) {
        DistributionSummary.builder("smartroute.cost.saved")
                .description("Estimated savings per request versus the baseline venue, USD")
                .register(registry)
                .record(usd);
    }
}
