package com.smartroute.core.execution;

import com.smartroute.core.anonymize.Anonymizer;
import com.smartroute.core.model.AttemptRecord;
import com.smartroute.core.model.CapabilityTier;
import com.smartroute.core.model.ComplexityClass;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingDecision;
import com.smartroute.core.model.RoutingPreferences;
import com.smartroute.core.model.RoutingRequest;
import com.smartroute.core.model.RoutingStrategy;
import com.smartroute.core.model.SensitivityLevel;
import com.smartroute.core.model.Venue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link VenueExecutor}.
 */
class VenueExecutorTest {

    private static final RoutingRequest REQUEST =
            new RoutingRequest("REQ-2026-0001", "def compute_total(order_items): pass", "code_explanation");

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static RoutingDecision decision(Venue primary, Venue... fallbacks) {
        var costs = new EnumMap<Venue, Double>(Venue.class);
        costs.put(Venue.LOCAL, 0.0001);
        costs.put(Venue.CLOUD_DIRECT, 0.012);
        costs.put(Venue.CLOUD_ANONYMIZED, 0.0121);
        costs.put(Venue.HYBRID, 0.0037);
        RoutingStrategy strategy = switch (primary) {
            case LOCAL -> RoutingStrategy.LOCAL_PREFERRED;
            case CLOUD_DIRECT -> RoutingStrategy.CLOUD_DIRECT;
            case CLOUD_ANONYMIZED -> RoutingStrategy.CLOUD_ANONYMIZED;
            case HYBRID -> RoutingStrategy.HYBRID;
        };
        return new RoutingDecision(REQUEST.id(), strategy, primary, List.of(fallbacks), 0.8, 0.9,
                costs.get(primary), 0.0121, 100, costs, SensitivityLevel.LOW, ComplexityClass.MEDIUM,
                CapabilityTier.MEDIUM, RoutingPreferences.defaults(), "test");
    }

    private static ExecutionBackend replying(String output, double quality) {
        return (content, taskType, timeout) -> new BackendResponse(output, quality);
    }

    private static ExecutionBackend failing(String message) {
        return (content, taskType, timeout) -> {
            throw new ExecutionBackendException(message);
        };
    }

    private static ExecutionBackend sleeping(long millis, CountDownLatch started) {
        return (content, taskType, timeout) -> {
            started.countDown();
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionBackendException("interrupted", e);
            }
            return new BackendResponse("late", 0.9);
        };
    }

    private VenueExecutor executor(Map<Venue, ExecutionBackend> backends, Duration attemptTimeout,
                                   Duration deadline) {
        return new VenueExecutor(new BackendRegistry(backends), new Anonymizer(), pool, attemptTimeout, deadline);
    }

    private VenueExecutor executor(Map<Venue, ExecutionBackend> backends) {
        return executor(backends, Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    @Nested
    @DisplayName("fallback chain")
    class FallbackChain {

        @Test
        @DisplayName("primary success stops the walk")
        void primarySucceeds() {
            var result = executor(Map.of(Venue.LOCAL, replying("done", 0.9),
                    Venue.CLOUD_DIRECT, failing("never called")))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertTrue(result.isSuccess());
            assertEquals(Venue.LOCAL, result.venueUsed());
            assertEquals("done", result.output());
            assertEquals(0.0001, result.actualCost(), 1e-12);
            assertEquals(1, result.attempts().size());
            assertEquals(0, result.failedAttempts());
        }

        @Test
        @DisplayName("a failing primary advances to the fallback")
        void failingPrimary() {
            var result = executor(Map.of(Venue.LOCAL, failing("model not loaded"),
                    Venue.CLOUD_DIRECT, replying("remote answer", 0.9)))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertTrue(result.isSuccess());
            assertEquals(Venue.CLOUD_DIRECT, result.venueUsed());
            assertEquals(0.012, result.actualCost(), 1e-12);
            assertEquals(AttemptRecord.Outcome.FAILED, result.attempts().get(0).outcome());
            assertEquals("model not loaded", result.attempts().get(0).detail());
            assertEquals(1, result.failedAttempts());
        }

        @Test
        @DisplayName("a venue without a backend is skipped")
        void unavailableVenue() {
            var result = executor(Map.of(Venue.CLOUD_DIRECT, replying("ok", 0.9)))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertEquals(Venue.CLOUD_DIRECT, result.venueUsed());
            assertEquals(AttemptRecord.Outcome.UNAVAILABLE, result.attempts().get(0).outcome());
        }

        @Test
        @DisplayName("every venue failing yields routing_failed")
        void allFail() {
            var result = executor(Map.of(Venue.LOCAL, failing("a"), Venue.CLOUD_DIRECT, failing("b"),
                    Venue.HYBRID, failing("c")))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT, Venue.HYBRID));

            assertFalse(result.isSuccess());
            assertEquals(ExecutionResult.ROUTING_FAILED, result.error());
            assertNull(result.venueUsed());
            assertEquals("", result.output());
            assertEquals(3, result.attempts().size());
            assertEquals(3, result.failedAttempts());
        }
    }

    @Nested
    @DisplayName("quality threshold")
    class Quality {

        @Test
        @DisplayName("low quality advances to the next venue")
        void lowQualityAdvances() {
            var result = executor(Map.of(Venue.LOCAL, replying("meh", 0.3),
                    Venue.CLOUD_DIRECT, replying("good", 0.9)))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertEquals(Venue.CLOUD_DIRECT, result.venueUsed());
            assertEquals(AttemptRecord.Outcome.LOW_QUALITY, result.attempts().get(0).outcome());
        }

        @Test
        @DisplayName("low quality on the only venue is returned with a warning")
        void lowQualityOnOnlyVenue() {
            var result = executor(Map.of(Venue.LOCAL, replying("meh", 0.3)))
                    .execute(REQUEST, decision(Venue.LOCAL));

            assertTrue(result.isSuccess());
            assertEquals("meh", result.output());
            assertEquals(0.3, result.qualityScore(), 1e-9);
            assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("low_quality")));
        }

        @Test
        @DisplayName("a low-quality answer is kept when the remaining venues are unavailable")
        void lowQualityKeptWhenFallbacksUnavailable() {
            var result = executor(Map.of(Venue.LOCAL, replying("partial answer", 0.5)))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_ANONYMIZED, Venue.HYBRID));

            assertTrue(result.isSuccess());
            assertEquals(Venue.LOCAL, result.venueUsed());
            assertEquals("partial answer", result.output());
            assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith("low_quality: LOCAL")));
            assertEquals(List.of(AttemptRecord.Outcome.LOW_QUALITY, AttemptRecord.Outcome.UNAVAILABLE,
                            AttemptRecord.Outcome.UNAVAILABLE),
                    result.attempts().stream().map(AttemptRecord::outcome).toList());
        }

        @Test
        @DisplayName("the best of several low-quality answers wins when later venues fail")
        void bestLowQualityWins() {
            var backends = new EnumMap<Venue, ExecutionBackend>(Venue.class);
            backends.put(Venue.LOCAL, replying("weak", 0.2));
            backends.put(Venue.CLOUD_ANONYMIZED, replying("closer", 0.55));
            backends.put(Venue.CLOUD_DIRECT, failing("HTTP 503"));

            var result = executor(backends)
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_ANONYMIZED, Venue.CLOUD_DIRECT));

            assertTrue(result.isSuccess());
            assertEquals(Venue.CLOUD_ANONYMIZED, result.venueUsed());
            assertEquals("closer", result.output());
            assertEquals(0.0121, result.actualCost(), 1e-9);
        }
    }

    @Nested
    @DisplayName("timeouts")
    class Timeouts {

        @Test
        @DisplayName("a slow venue times out and the next one runs")
        void attemptTimeout() {
            var result = executor(Map.of(Venue.LOCAL, sleeping(5_000, new CountDownLatch(1)),
                    Venue.CLOUD_DIRECT, replying("fast", 0.9)), Duration.ofMillis(100), Duration.ofSeconds(10))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertEquals(Venue.CLOUD_DIRECT, result.venueUsed());
            assertEquals(AttemptRecord.Outcome.TIMED_OUT, result.attempts().get(0).outcome());
        }

        @Test
        @DisplayName("a backend-reported timeout counts as timed out")
        void backendTimeout() {
            ExecutionBackend slow = (content, taskType, timeout) -> {
                throw new ExecutionTimeoutException("slow", timeout);
            };
            var result = executor(Map.of(Venue.LOCAL, slow, Venue.CLOUD_DIRECT, replying("ok", 0.9)))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertEquals(AttemptRecord.Outcome.TIMED_OUT, result.attempts().get(0).outcome());
        }

        @Test
        @DisplayName("the overall deadline stops the walk")
        void overallDeadline() {
            var result = executor(Map.of(Venue.LOCAL, sleeping(5_000, new CountDownLatch(1)),
                    Venue.CLOUD_DIRECT, replying("never", 0.9)), Duration.ofSeconds(1), Duration.ofMillis(100))
                    .execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT));

            assertEquals(ExecutionResult.ROUTING_FAILED, result.error());
            assertEquals(1, result.attempts().size());
            assertTrue(result.warnings().stream().anyMatch(w -> w.contains("deadline exceeded")));
        }
    }

    @Nested
    @DisplayName("anonymized venue")
    class Anonymized {

        @Test
        @DisplayName("identifiers never reach the backend and are restored in the output")
        void roundTrip() {
            var seen = new AtomicReference<String>();
            ExecutionBackend echo = (content, taskType, timeout) -> {
                seen.set(content);
                return new BackendResponse("Explained: " + content, 0.9);
            };
            var result = executor(Map.of(Venue.CLOUD_ANONYMIZED, echo))
                    .execute(REQUEST, decision(Venue.CLOUD_ANONYMIZED));

            assertFalse(seen.get().contains("compute_total"));
            assertFalse(seen.get().contains("order_items"));
            assertEquals("Explained: " + REQUEST.content(), result.output());
            assertTrue(result.warnings().isEmpty());
        }

        @Test
        @DisplayName("placeholders invented by the backend are reported")
        void inventedPlaceholder() {
            var result = executor(Map.of(Venue.CLOUD_ANONYMIZED, replying("see __ph_abc_42__", 0.9)))
                    .execute(REQUEST, decision(Venue.CLOUD_ANONYMIZED));

            assertTrue(result.isSuccess());
            assertEquals("see __ph_abc_42__", result.output());
            assertEquals(1, result.warnings().size());
        }

        @Test
        @DisplayName("other venues receive the original content")
        void directVenueUntouched() {
            var seen = new AtomicReference<String>();
            ExecutionBackend capture = (content, taskType, timeout) -> {
                seen.set(content);
                return new BackendResponse("ok", 0.9);
            };
            executor(Map.of(Venue.CLOUD_DIRECT, capture)).execute(REQUEST, decision(Venue.CLOUD_DIRECT));
            assertEquals(REQUEST.content(), seen.get());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        @DisplayName("a cancelled token skips every venue")
        void cancelledBeforeStart() {
            var token = new CancellationToken();
            token.cancel();
            var result = executor(Map.of(Venue.LOCAL, replying("x", 0.9)))
                    .execute(REQUEST, decision(Venue.LOCAL), token);

            assertEquals(ExecutionResult.CANCELLED, result.error());
            assertTrue(result.attempts().isEmpty());
        }

        @Test
        @DisplayName("cancelling mid-attempt aborts the backend call and the remaining chain")
        void cancelledInFlight() throws Exception {
            var started = new CountDownLatch(1);
            var token = new CancellationToken();
            var executor = executor(Map.of(Venue.LOCAL, sleeping(10_000, started),
                    Venue.CLOUD_DIRECT, replying("should not run", 0.9)));

            CompletableFuture<ExecutionResult> future = CompletableFuture.supplyAsync(
                    () -> executor.execute(REQUEST, decision(Venue.LOCAL, Venue.CLOUD_DIRECT), token));
            assertTrue(started.await(5, TimeUnit.SECONDS));
            token.cancel();

            var result = future.get(5, TimeUnit.SECONDS);
            assertEquals(ExecutionResult.CANCELLED, result.error());
            assertEquals(1, result.attempts().size());
            assertEquals(AttemptRecord.Outcome.CANCELLED, result.attempts().get(0).outcome());
        }
    }
}
