package com.cardintel.catalog.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of the rate governor's counters.
 */
public record RateState(int consecutiveFailures, Duration currentDelay, Instant cooldownUntil) {
}
