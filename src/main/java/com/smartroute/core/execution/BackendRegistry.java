package com.smartroute.core.execution;

import com.smartroute.core.model.Venue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable venue-to-backend assignment, fixed at router construction.
 */
public final class BackendRegistry {

    private final Map<Venue, ExecutionBackend> backends;

    public BackendRegistry(Map<Venue, ExecutionBackend> backends) {
        this.backends = backends.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(backends));
    }

    public static BackendRegistry empty() {
        return new BackendRegistry(Map.of());
    }

    public Optional<ExecutionBackend> find(Venue venue) {
        return Optional.ofNullable(backends.get(venue));
    }

    public boolean isRegistered(Venue venue) {
        return backends.containsKey(venue);
    }

    public Map<Venue, ExecutionBackend> asMap() {
        return backends;
    }
}
