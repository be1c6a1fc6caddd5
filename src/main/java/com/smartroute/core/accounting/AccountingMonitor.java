package com.smartroute.core.accounting;

import com.smartroute.core.model.AccountingSnapshot;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import com.smartroute.core.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide cost, savings and compliance counters.
 * <p>
 * Every mutation happens under one lock, so each {@link #record} is applied
 * atomically. Averages use incremental means. A rolling window of recent
 * requests backs the "recent savings" figures; it is bounded both by age and
 * by entry count.
 */
public class AccountingMonitor {

    private static final Logger log = LoggerFactory.getLogger(AccountingMonitor.class);

    private record WindowEntry(Instant at, double saved) {}

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Duration window;
    private final int maxWindowEntries;
    private final List<AccountingSink> sinks;

    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private long failedAttempts;
    private final EnumMap<Venue, Long> perVenue = new EnumMap<>(Venue.class);
    private final EnumMap<RoutingStrategy, Long> perStrategy = new EnumMap<>(RoutingStrategy.class);
    private final EnumMap<SensitivityLevel, Long> perSensitivity = new EnumMap<>(SensitivityLevel.class);
    private double totalActualCost;
    private double totalBaselineCost;
    private double totalCostSaved;
    private long tokensKeptLocal;
    private long privacyViolations;
    private double averageLatencyMs;
    private double averageQuality;
    private final ArrayDeque<WindowEntry> recent = new ArrayDeque<>();
    private double recentSavings;
    private Instant since;

    public AccountingMonitor() {
        this(Clock.systemUTC(), Duration.ofHours(24), 10_000, List.of());
    }

    public AccountingMonitor(Clock clock, Duration window, int maxWindowEntries, List<AccountingSink> sinks) {
        if (maxWindowEntries <= 0) {
            throw new IllegalArgumentException("maxWindowEntries must be positive");
        }
        this.clock = clock;
        this.window = window;
        this.maxWindowEntries = maxWindowEntries;
        this.sinks = List.copyOf(sinks);
        this.since = clock.instant();
    }

    public void record(ExecutionResult result, RoutingDecision decision) {
        Instant now = clock.instant();
        boolean violation = false;
        lock.lock();
        try {
            totalRequests++;
            perStrategy.merge(decision.strategy(), 1L, Long::sum);
            perSensitivity.merge(decision.sensitivity(), 1L, Long::sum);
            failedAttempts += result.failedAttempts();

            double saved = 0.0;
            if (result.isSuccess()) {
                successfulRequests++;
                Venue venue = result.venueUsed();
                perVenue.merge(venue, 1L, Long::sum);
                totalActualCost += result.actualCost();
                totalBaselineCost += decision.baselineCost();
                saved = decision.baselineCost() - result.actualCost();
                totalCostSaved += saved;
                if (venue.isLocal()) {
                    tokensKeptLocal += decision.estimatedTokens();
                }
                averageLatencyMs += (result.latencyMs() - averageLatencyMs) / successfulRequests;
                averageQuality += (result.qualityScore() - averageQuality) / successfulRequests;

                violation = (decision.sensitivity() == SensitivityLevel.HIGH && venue.isRemote())
                        || !decision.chain().contains(venue);
                if (violation) {
                    privacyViolations++;
                }
            } else {
                failedRequests++;
            }

            recent.addLast(new WindowEntry(now, saved));
            recentSavings += saved;
            evict(now);
        } finally {
            lock.unlock();
        }

        if (violation) {
            log.warn("Privacy violation: request {} ({}) executed on {}",
                    result.requestId(), decision.sensitivity(), result.venueUsed());
        }
        for (AccountingSink sink : sinks) {
            try {
                sink.accept(decision, result);
            } catch (RuntimeException e) {
                log.warn("Accounting sink {} failed: {}", sink.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public AccountingSnapshot snapshot() {
        Instant now = clock.instant();
        lock.lock();
        try {
            evict(now);
            return new AccountingSnapshot(totalRequests, successfulRequests, failedRequests, failedAttempts,
                    copy(perVenue), copy(perStrategy), copy(perSensitivity),
                    totalActualCost, totalBaselineCost, totalCostSaved, tokensKeptLocal, privacyViolations,
                    averageLatencyMs, averageQuality, recentSavings, recent.size(), since, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zeroes every counter. Administrative action only.
     */
    public void reset() {
        lock.lock();
        try {
            totalRequests = 0;
            successfulRequests = 0;
            failedRequests = 0;
            failedAttempts = 0;
            perVenue.clear();
            perStrategy.clear();
            perSensitivity.clear();
            totalActualCost = 0;
            totalBaselineCost = 0;
            totalCostSaved = 0;
            tokensKeptLocal = 0;
            privacyViolations = 0;
            averageLatencyMs = 0;
            averageQuality = 0;
            recent.clear();
            recentSavings = 0;
            since = clock.instant();
        } finally {
            lock.unlock();
        }
        log.info("Accounting statistics reset");
    }

    private void evict(Instant now) {
        Instant cutoff = now.minus(window);
        while (!recent.isEmpty()
                && (recent.size() > maxWindowEntries || recent.peekFirst().at().isBefore(cutoff))) {
            recentSavings -= recent.removeFirst().saved();
        }
        if (recent.isEmpty()) {
            recentSavings = 0.0;
        }
    }

    private static <K extends Enum<K>> Map<K, Long> copy(EnumMap<K, Long> source) {
        return Map.copyOf(source);
    }
}
