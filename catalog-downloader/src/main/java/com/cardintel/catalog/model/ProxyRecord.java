package com.cardintel.catalog.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Counters for one egress route.
 *
 * Traffic counters (attempts, successes, rateLimited, serverErrors) are fed only by real
 * requests. Health fields are fed only by probes.
 */
@Data
@Builder(toBuilder = true)
public class ProxyRecord {

    private String name;

    /** http://host:port of the proxy, null for a direct route */
    private String proxyUri;

    private long attempts;
    private long successes;
    private long rateLimited;
    private long serverErrors;

    // ── Health (probe-driven) ───────────────────────────────────────────────
    /** null until the first probe */
    private Boolean healthy;
    private int consecutiveProbeFailures;
    private Instant lastCheckedAt;
    private Instant lastHealthyAt;

    /** Untried routes rank as perfect so they get a chance. */
    public double successRatio() {
        return attempts == 0 ? 1.0 : (double) successes / attempts;
    }
}
