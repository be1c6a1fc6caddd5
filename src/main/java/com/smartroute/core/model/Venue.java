package com.smartroute.core.model;

/**
 * An execution target. Each venue carries a fixed privacy score used to
 * order fallback chains (higher is more private).
 */
public enum Venue {
    /** On-device model; content never leaves the host. */
    LOCAL(1.0),
    /** Remote model called with identifiers and literals replaced by placeholders. */
    CLOUD_ANONYMIZED(0.7),
    /** Content split between the local and the remote model. */
    HYBRID(0.6),
    /** Remote model called with the raw content. */
    CLOUD_DIRECT(0.3);

    private final double privacyScore;

    Venue(double privacyScore) {
        this.privacyScore = privacyScore;
    }

    public double privacyScore() {
        return privacyScore;
    }

    public boolean isLocal() {
        return this == LOCAL;
    }

    public boolean isRemote() {
        return this != LOCAL;
    }
}
