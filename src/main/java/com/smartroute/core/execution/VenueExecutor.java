package com.smartroute.core.execution;

import com.smartroute.core.anonymize.AnonymizationResult;
import com.smartroute.core.anonymize.Anonymizer;
import com.smartroute.core.anonymize.RestoreResult;
import com.smartroute.core.logging.MdcContext;
import com.smartroute.core.model.AttemptRecord;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.RoutingRequest;
import com.smartroute.core.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Walks a decision's venue chain until one backend produces acceptable output.
 * <p>
 * Each attempt runs on the supplied pool and is bounded by the smaller of the
 * per-attempt timeout and what is left of the overall deadline. A missing
 * backend, a backend error, a timeout or a below-threshold quality score
 * advances to the next venue. When no venue clears the threshold, the best
 * below-threshold answer is returned with a {@code low_quality} warning rather
 * than failing the request. Cancelling the token, or interrupting the calling thread, aborts the
 * in-flight attempt and skips the rest of the chain.
 */
public class VenueExecutor {

    private static final Logger log = LoggerFactory.getLogger(VenueExecutor.class);

    private final BackendRegistry backends;
    private final Anonymizer anonymizer;
    private final ExecutorService pool;
    private final Duration attemptTimeout;
    private final Duration overallDeadline;

    public VenueExecutor(BackendRegistry backends, Anonymizer anonymizer, ExecutorService pool,
                         Duration attemptTimeout, Duration overallDeadline) {
        this.backends = backends;
        this.anonymizer = anonymizer;
        this.pool = pool;
        this.attemptTimeout = attemptTimeout;
        this.overallDeadline = overallDeadline;
    }

    public ExecutionResult execute(RoutingRequest request, RoutingDecision decision) {
        return execute(request, decision, CancellationToken.none());
    }

    public ExecutionResult execute(RoutingRequest request, RoutingDecision decision, CancellationToken token) {
        long start = System.nanoTime();
        long deadline = start + overallDeadline.toNanos();
        List<Venue> chain = decision.chain();
        var attempts = new ArrayList<AttemptRecord>();
        var warnings = new ArrayList<String>();
        Candidate best = null;

        for (Venue venue : chain) {
            if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                return cancelled(request, start, attempts, warnings, venue);
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Overall deadline of {}ms reached before trying {}", overallDeadline.toMillis(), venue);
                warnings.add("deadline exceeded before trying " + venue);
                break;
            }

            Optional<ExecutionBackend> backend = backends.find(venue);
            if (backend.isEmpty()) {
                log.warn("No backend registered for {}, advancing", venue);
                attempts.add(new AttemptRecord(venue, AttemptRecord.Outcome.UNAVAILABLE, 0, "no backend registered"));
                continue;
            }

            Duration timeout = Duration.ofNanos(Math.min(attemptTimeout.toNanos(), remaining));
            MdcContext.setVenue(request.id(), venue.name());
            try {
                Attempt attempt = attempt(request, decision, venue, backend.get(), timeout, token);
                attempts.add(attempt.record());
                warnings.addAll(attempt.warnings());
                switch (attempt.record().outcome()) {
                    case SUCCEEDED -> {
                        return new ExecutionResult(request.id(), attempt.response().output(), venue,
                                decision.costOf(venue), attempt.response().qualityScore(), elapsedMs(start),
                                null, attempts, warnings);
                    }
                    case LOW_QUALITY -> {
                        if (best == null || attempt.response().qualityScore() > best.response().qualityScore()) {
                            best = new Candidate(venue, attempt.response());
                        }
                        log.info("{} quality {} below threshold {}, advancing", venue,
                                attempt.response().qualityScore(), decision.preferences().qualityThreshold());
                    }
                    case CANCELLED -> {
                        return ExecutionResult.failure(request.id(), ExecutionResult.CANCELLED, elapsedMs(start),
                                attempts, warnings);
                    }
                    default -> log.warn("Attempt on {} {}: {}, advancing", venue,
                            attempt.record().outcome(), attempt.record().detail());
                }
            } finally {
                MdcContext.clearVenue();
            }
        }

        if (best != null) {
            log.info("No venue met quality threshold {} for request {}; using {} output",
                    decision.preferences().qualityThreshold(), request.id(), best.venue());
            warnings.add("low_quality: " + best.venue() + " scored " + best.response().qualityScore()
                    + ", below threshold " + decision.preferences().qualityThreshold());
            return new ExecutionResult(request.id(), best.response().output(), best.venue(),
                    decision.costOf(best.venue()), best.response().qualityScore(), elapsedMs(start),
                    null, attempts, warnings);
        }
        log.warn("All {} venue(s) failed for request {}", chain.size(), request.id());
        return ExecutionResult.failure(request.id(), ExecutionResult.ROUTING_FAILED, elapsedMs(start),
                attempts, warnings);
    }

    private record Attempt(AttemptRecord record, BackendResponse response, List<String> warnings) {}

    private record Candidate(Venue venue, BackendResponse response) {}

    private Attempt attempt(RoutingRequest request, RoutingDecision decision, Venue venue,
                            ExecutionBackend backend, Duration timeout, CancellationToken token) {
        AnonymizationResult anonymized = venue == Venue.CLOUD_ANONYMIZED ? anonymizer.anonymize(request.content()) : null;
        String payload = anonymized == null ? request.content() : anonymized.text();

        long attemptStart = System.nanoTime();
        Future<BackendResponse> future = pool.submit(() -> backend.execute(payload, request.taskType(), timeout));
        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        try {
            BackendResponse response = future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            long latency = elapsedMs(attemptStart);
            List<String> warnings = List.of();
            if (anonymized != null) {
                RestoreResult restored = anonymizer.restore(response.output(), anonymized.mapping());
                response = new BackendResponse(restored.text(), response.qualityScore());
                warnings = restored.warnings();
            }
            var outcome = response.qualityScore() < decision.preferences().qualityThreshold()
                    ? AttemptRecord.Outcome.LOW_QUALITY
                    : AttemptRecord.Outcome.SUCCEEDED;
            return new Attempt(new AttemptRecord(venue, outcome, latency, ""), response, warnings);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failed(venue, AttemptRecord.Outcome.TIMED_OUT, attemptStart,
                    backend.name() + " timed out after " + timeout.toMillis() + "ms");
        } catch (CancellationException e) {
            return failed(venue, AttemptRecord.Outcome.CANCELLED, attemptStart, "cancelled by caller");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            var outcome = cause instanceof ExecutionTimeoutException
                    ? AttemptRecord.Outcome.TIMED_OUT
                    : AttemptRecord.Outcome.FAILED;
            log.debug("Backend {} failed", backend.name(), cause);
            return failed(venue, outcome, attemptStart, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return failed(venue, AttemptRecord.Outcome.CANCELLED, attemptStart, "interrupted");
        } finally {
            registration.remove();
        }
    }

    private static Attempt failed(Venue venue, AttemptRecord.Outcome outcome, long attemptStart, String detail) {
        return new Attempt(new AttemptRecord(venue, outcome, elapsedMs(attemptStart), detail), null, List.of());
    }

    private static ExecutionResult cancelled(RoutingRequest request, long start, List<AttemptRecord> attempts,
                                             List<String> warnings, Venue next) {
        log.info("Request {} cancelled before trying {}", request.id(), next);
        return ExecutionResult.failure(request.id(), ExecutionResult.CANCELLED, elapsedMs(start), attempts, warnings);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
