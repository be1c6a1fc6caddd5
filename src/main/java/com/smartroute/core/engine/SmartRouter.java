package com.smartroute.core.engine;

import com.smartroute.core.accounting.AccountingMonitor;
import com.smartroute.core.capability.CapabilityEstimator;
import com.smartroute.core.classifier.SensitivityClassifier;
import com.smartroute.core.cost.CostModel;
import com.smartroute.core.events.EventBus;
import com.smartroute.core.events.RoutingEvent;
import com.smartroute.core.execution.CancellationToken;
import com.smartroute.core.execution.VenueExecutor;
import com.smartroute.core.logging.MdcContext;
import com.smartroute.core.metrics.RouterMetrics;
import com.smartroute.core.model.AccountingSnapshot;
import com.smartroute.core.model.AttemptRecord;
import com.smartroute.core.model.CapabilityAssessment;
import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.CostEstimate;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.RoutingPreferences;
import com.smartroute.core.model.RoutingRequest;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import com.smartroute.core.model.SensitivityReport;
import com.smartroute.core.model.Venue;
import com.smartroute.core.policy.PolicyDecisionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Year;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entry point for routing: {@link #route}, {@link #routeAndExecute} and {@link #report}.
 * <p>
 * Classification, capability estimation and cost estimation run concurrently
 * on the analysis pool, then the decision matrix combines them. None of the
 * public operations throw; failures come back as a conservative decision or as
 * an {@link ExecutionResult} carrying an error code.
 */
public class SmartRouter {

    private static final Logger log = LoggerFactory.getLogger(SmartRouter.class);

    private final SensitivityClassifier classifier;
    private final CapabilityEstimator estimator;
    private final CostModel costModel;
    private final PolicyDecisionMatrix matrix;
    private final VenueExecutor executor;
    private final AccountingMonitor accounting;
    private final RoutingPreferences defaults;
    private final ExecutorService analysisPool;
    private final ExecutorService requestPool;
    private final RouterMetrics metrics;
    private final EventBus eventBus;
    private final AtomicInteger requestCounter = new AtomicInteger(0);

    public SmartRouter(SensitivityClassifier classifier, CapabilityEstimator estimator, CostModel costModel,
                       PolicyDecisionMatrix matrix, VenueExecutor executor, AccountingMonitor accounting,
                       RoutingPreferences defaults, ExecutorService analysisPool, ExecutorService requestPool,
                       RouterMetrics metrics, EventBus eventBus) {
        this.classifier = classifier;
        this.estimator = estimator;
        this.costModel = costModel;
        this.matrix = matrix;
        this.executor = executor;
        this.accounting = accounting;
        this.defaults = defaults;
        this.analysisPool = analysisPool;
        this.requestPool = requestPool;
        this.metrics = metrics;
        this.eventBus = eventBus;
    }

    /**
     * Generates a request ID in the format REQ-YYYY-NNNN.
     */
    public String generateRequestId() {
        int seq = requestCounter.incrementAndGet();
        return String.format("REQ-%d-%04d", Year.now().getValue(), seq);
    }

    public RoutingRequest newRequest(String content, String taskType, Map<String, Object> preferences) {
        return new RoutingRequest(generateRequestId(), content, taskType, preferences);
    }

    public RoutingPreferences defaultPreferences() {
        return defaults;
    }

    /**
     * Decides where a request should run without executing it.
     */
    public RoutingDecision route(RoutingRequest request) {
        MdcContext.setRequest(request.id());
        long start = System.currentTimeMillis();
        try {
            RoutingPreferences preferences = defaults.withOverrides(request.preferences());
            String content = request.content();

            var sensitivity = fork(() -> classifier.classify(content),
                    e -> SensitivityReport.failClosed(e.getClass().getSimpleName()));
            var capability = fork(() -> estimator.estimate(request.taskType(), content),
                    e -> fallbackCapability(request.taskType()));
            var cost = fork(() -> costModel.estimate(content),
                    e -> new CostModel().estimate(content));
            CompletableFuture.allOf(sensitivity, capability, cost).join();

            RoutingDecision decision;
            try {
                decision = matrix.decide(request.id(), sensitivity.join(), capability.join(), cost.join(), preferences);
            } catch (RuntimeException e) {
                log.error("Decision matrix failed for request {}; routing locally", request.id(), e);
                decision = conservativeDecision(request.id(), sensitivity.join(), capability.join(),
                        cost.join(), preferences);
            }

            long elapsed = System.currentTimeMillis() - start;
            log.info("Routed {} -> {} via {} (sensitivity {}, confidence {})", request.id(),
                    decision.primaryVenue(), decision.strategy(), decision.sensitivity(),
                    String.format("%.2f", decision.confidence()));
            if (metrics != null) {
                metrics.recordDecision(decision.strategy(), decision.sensitivity());
                metrics.recordRouteDuration(elapsed);
            }
            publish("request.routed", request.id(), decision.primaryVenue(), Map.of(
                    "strategy", decision.strategy().name(),
                    "sensitivity", decision.sensitivity().name(),
                    "fallbacks", decision.fallbackChain().stream().map(Venue::name).toList()));
            return decision;
        } finally {
            MdcContext.clear();
        }
    }

    public ExecutionResult routeAndExecute(RoutingRequest request) {
        return routeAndExecute(request, CancellationToken.none());
    }

    /**
     * Routes and executes a request, then records the outcome. Every request is
     * recorded exactly once, including failed and cancelled ones.
     */
    public ExecutionResult routeAndExecute(RoutingRequest request, CancellationToken token) {
        RoutingDecision decision = route(request);
        MdcContext.setRequest(request.id());
        try {
            ExecutionResult result;
            try {
                result = executor.execute(request, decision, token);
            } catch (RuntimeException e) {
                log.error("Executor failed for request {}", request.id(), e);
                result = ExecutionResult.failure(request.id(), ExecutionResult.ROUTING_FAILED, 0, List.of(),
                        List.of("executor error: " + e.getMessage()));
            }
            accounting.record(result, decision);
            recordOutcome(request.id(), decision, result);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs {@link #routeAndExecute} on the request pool. Cancelling the returned
     * future aborts the in-flight backend call and skips remaining venues.
     */
    public CompletableFuture<ExecutionResult> routeAndExecuteAsync(RoutingRequest request) {
        var token = new CancellationToken();
        CompletableFuture<ExecutionResult> future =
                CompletableFuture.supplyAsync(() -> routeAndExecute(request, token), requestPool);
        future.whenComplete((result, error) -> {
            if (error instanceof CancellationException) {
                token.cancel();
            }
        });
        return future;
    }

    public AccountingSnapshot report() {
        return accounting.snapshot();
    }

    public void resetStatistics() {
        accounting.reset();
    }

    private void recordOutcome(String requestId, RoutingDecision decision, ExecutionResult result) {
        for (AttemptRecord attempt : result.attempts()) {
            if (metrics != null) {
                metrics.recordAttempt(attempt);
            }
            if (!attempt.succeeded()) {
                publish("attempt.failed", requestId, attempt.venue(), Map.of(
                        "outcome", attempt.outcome().name(), "detail", attempt.detail()));
            }
        }
        if (result.isSuccess()) {
            log.info("Request {} served by {} in {}ms (quality {})", requestId, result.venueUsed(),
                    result.latencyMs(), String.format("%.2f", result.qualityScore()));
            if (metrics != null) {
                metrics.recordRequestResult("succeeded");
                metrics.recordCostSaved(decision.baselineCost() - result.actualCost());
            }
            publish("request.executed", requestId, result.venueUsed(), Map.of(
                    "latency_ms", result.latencyMs(), "actual_cost", result.actualCost()));
        } else {
            log.warn("Request {} failed: {} after {} attempt(s)", requestId, result.error(), result.attempts().size());
            if (metrics != null) {
                metrics.recordRequestResult(result.error());
            }
            publish("request.failed", requestId, null, Map.of(
                    "error", result.error(), "attempts", result.attempts().size()));
        }
    }

    private void publish(String type, String requestId, Venue venue, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(RoutingEvent.of(type, requestId, venue == null ? null : venue.name(),
                    new LinkedHashMap<>(payload)));
        }
    }

    private <T> CompletableFuture<T> fork(Supplier<T> task, Function<Throwable, T> fallback) {
        try {
            return CompletableFuture.supplyAsync(task, analysisPool).exceptionally(e -> {
                log.warn("Analysis step failed, using fallback: {}", e.getMessage());
                return fallback.apply(e);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Analysis pool rejected task, running inline");
            try {
                return CompletableFuture.completedFuture(task.get());
            } catch (RuntimeException inline) {
                return CompletableFuture.completedFuture(fallback.apply(inline));
            }
        }
    }

    private static CapabilityAssessment fallbackCapability(String taskType) {
        return new CapabilityAssessment(taskType, ComplexityClass.MEDIUM, CapabilityTier.fromScore(0.5),
                0.5, 5_000, false);
    }

    private static RoutingDecision conservativeDecision(String requestId, SensitivityReport sensitivity,
                                                        CapabilityAssessment capability, CostEstimate cost,
                                                        RoutingPreferences preferences) {
        var venueCosts = new EnumMap<Venue, Double>(Venue.class);
        cost.costs().forEach((venue, c) -> venueCosts.put(venue, c.totalCost()));
        SensitivityLevel level = sensitivity.level();
        return new RoutingDecision(requestId, RoutingStrategy.LOCAL_ONLY, Venue.LOCAL, List.of(), 0.0,
                RoutingStrategy.LOCAL_ONLY.privacyScore(), cost.costOf(Venue.LOCAL), cost.baselineCost(),
                cost.totalTokens(), venueCosts, level, capability.complexity(), capability.tier(), preferences,
                "decision matrix unavailable; routed locally");
    }
}
