package com.cardintel.catalog.model;

/**
 * Classification of a single upstream request, shared by the rate governor,
 * the proxy pool and the fetcher.
 */
public enum RequestOutcome {
    OK,
    RATE_LIMITED,   // 403 / 429
    SERVER_ERROR,   // 5xx, timeouts, connection resets
    CLIENT_ERROR;   // 404, malformed payload

    public boolean isThrottleSignal() {
        return this == RATE_LIMITED || this == SERVER_ERROR;
    }
}
