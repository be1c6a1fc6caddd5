package com.smartroute.core.model;

/**
 * One attempt at executing a request on a venue.
 *
 * @param venue     venue that was tried
 * @param outcome   what happened
 * @param latencyMs wall time spent on the attempt
 * @param detail    error message or warning, empty on success
 */
public record AttemptRecord(Venue venue, Outcome outcome, long latencyMs, String detail) {

    public enum Outcome { SUCCEEDED, FAILED, TIMED_OUT, LOW_QUALITY, UNAVAILABLE, CANCELLED }

    public AttemptRecord {
        detail = detail == null ? "" : detail;
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
