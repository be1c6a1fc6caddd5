package com.smartroute.core.health;

import com.smartroute.core.engine.SmartRouter;
import com.smartroute.core.execution.BackendRegistry;
import com.smartroute.core.model.Venue;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One health component per venue (UP when a backend is registered) plus the
 * accounting ledger.
 */
@Service
public class HealthCheckService {

    private final BackendRegistry backends;
    private final SmartRouter router;

    public HealthCheckService(BackendRegistry backends, SmartRouter router) {
        this.backends = backends;
        this.router = router;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        for (Venue venue : Venue.values()) {
            results.add(checkVenue(venue));
        }
        results.add(checkAccounting());
        return results;
    }

    private HealthStatus checkVenue(Venue venue) {
        return backends.find(venue)
                .map(backend -> HealthStatus.venueUp(venue, backend.name()))
                .orElseGet(() -> HealthStatus.venueMissing(venue));
    }

    private HealthStatus checkAccounting() {
        var snapshot = router.report();
        return new HealthStatus("accounting", HealthStatus.Status.UP,
                snapshot.totalRequests() + " requests recorded",
                Map.of("total_requests", snapshot.totalRequests(),
                        "privacy_violations", snapshot.privacyViolations()));
    }
}
