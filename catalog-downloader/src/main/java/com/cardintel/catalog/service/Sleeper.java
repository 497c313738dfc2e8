package com.cardintel.catalog.service;

import java.time.Duration;

/**
 * Suspension point used for pacing, so tests can run without real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
