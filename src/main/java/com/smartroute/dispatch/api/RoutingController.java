package com.smartroute.dispatch.api;

import com.smartroute.core.engine.SmartRouter;
import com.smartroute.core.model.ExecutionResult;
import com.smartroute.core.model.RoutingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;

/**
 * REST controller for routing decisions, execution and accounting reports.
 */
@RestController
@RequestMapping("/api/v1")
public class RoutingController {

    private static final Logger log = LoggerFactory.getLogger(RoutingController.class);

    private final SmartRouter router;
    private final RoutingEventStream eventStream;

    public RoutingController(SmartRouter router, RoutingEventStream eventStream) {
        this.router = router;
        this.eventStream = eventStream;
    }

    /**
     * POST /api/v1/route : Decide where a request should run, without executing it.
     */
    @PostMapping("/route")
    public ResponseEntity<?> route(@RequestBody RouteRequest body) {
        if (isBlank(body)) {
            return ResponseEntity.badRequest().body(Map.of("error", "content is required"));
        }
        RoutingRequest request = router.newRequest(body.content(), body.taskType(), body.preferences());
        return ResponseEntity.ok(DecisionResponse.from(router.route(request)));
    }

    /**
     * POST /api/v1/route/execute : Route and execute. Returns 502 when every venue failed.
     */
    @PostMapping("/route/execute")
    public ResponseEntity<?> routeAndExecute(@RequestBody RouteRequest body) {
        if (isBlank(body)) {
            return ResponseEntity.badRequest().body(Map.of("error", "content is required"));
        }
        RoutingRequest request = router.newRequest(body.content(), body.taskType(), body.preferences());
        ExecutionResult result = router.routeAndExecute(request);
        if (!result.isSuccess()) {
            log.warn("Request {} returned error {}", request.id(), result.error());
            return ResponseEntity.status(502).body(ExecutionResponse.from(result));
        }
        return ResponseEntity.ok(ExecutionResponse.from(result));
    }

    /**
     * GET /api/v1/events : SSE stream of routing events, optionally for one request.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@RequestParam(name = "request_id", required = false) String requestId) {
        String filter = requestId == null || requestId.isBlank() ? null : requestId;
        return ResponseEntity.ok(eventStream.open(filter));
    }

    /**
     * GET /api/v1/report : Cost, savings and privacy statistics.
     */
    @GetMapping("/report")
    public ResponseEntity<ReportResponse> report() {
        return ResponseEntity.ok(ReportResponse.from(router.report()));
    }

    /**
     * POST /api/v1/report/reset : Zero all statistics.
     */
    @PostMapping("/report/reset")
    public ResponseEntity<Void> reset() {
        log.info("Statistics reset requested via API");
        router.resetStatistics();
        return ResponseEntity.noContent().build();
    }

    private static boolean isBlank(RouteRequest body) {
        return body == null || body.content() == null || body.content().isBlank();
    }
}
