package com.cardintel.catalog.service;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.RateState;
import com.cardintel.catalog.model.RequestOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Paces requests against the catalog API and backs off on throttling.
 *
 * The API has no documented limit, so the limit is discovered from failure signals:
 * every 403/429 (and every repeated 5xx) increments a consecutive-failure counter,
 * which drives an exponential per-request delay capped at {@code rate.max-delay}, and
 * pushes out a global cooldown deadline that holds back every caller. Successes walk
 * the counter back down one step at a time; at zero the delay returns to the floor.
 *
 * Settings are read on every call, so command-line overrides applied to the
 * properties before a run take effect immediately.
 */
@Service
@Slf4j
public class RateGovernor {

    private final CatalogDownloaderProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;

    // guarded by this
    private int consecutiveFailures;
    private int serverErrorStreak;
    private Instant lastRequestAt;
    private Instant cooldownUntil = Instant.EPOCH;

    public RateGovernor(CatalogDownloaderProperties properties, Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Time the caller still has to wait before its next request: the larger of the
     * remaining pacing interval and the remaining global cooldown.
     */
    public synchronized Duration delayBeforeNextRequest() {
        Instant now = clock.instant();
        Duration pacing = Duration.ZERO;
        if (lastRequestAt != null) {
            pacing = Duration.between(now, lastRequestAt.plus(currentDelay()));
        }
        Duration cooldown = Duration.between(now, cooldownUntil);
        Duration wait = pacing.compareTo(cooldown) >= 0 ? pacing : cooldown;
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    /**
     * Suspends until a request may be issued, then reserves the slot.
     * Re-checks after every sleep because another worker may have extended the cooldown.
     */
    public void awaitPermit() throws InterruptedException {
        while (true) {
            Duration wait;
            synchronized (this) {
                wait = delayBeforeNextRequest();
                if (wait.isZero()) {
                    lastRequestAt = clock.instant();
                    return;
                }
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Interrupted while waiting for rate permit");
            }
            log.debug("Pacing: waiting {} ms before next request", wait.toMillis());
            sleeper.sleep(wait);
        }
    }

    public synchronized void recordOutcome(RequestOutcome outcome) {
        switch (outcome) {
            case OK -> {
                serverErrorStreak = 0;
                if (consecutiveFailures > 0) {
                    consecutiveFailures--;
                    if (consecutiveFailures == 0) {
                        log.info("Rate limiting cleared, delay back to {} ms", currentDelay().toMillis());
                    }
                }
            }
            case RATE_LIMITED -> {
                serverErrorStreak = 0;
                registerFailure(outcome);
            }
            case SERVER_ERROR -> {
                serverErrorStreak++;
                if (serverErrorStreak >= Math.max(1, settings().getServerErrorThreshold())) {
                    registerFailure(outcome);
                }
            }
            case CLIENT_ERROR -> {
                // not a throttling signal
            }
        }
    }

    public synchronized RateState snapshot() {
        return new RateState(consecutiveFailures, currentDelay(), cooldownUntil);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void registerFailure(RequestOutcome outcome) {
        consecutiveFailures++;
        Duration delay = currentDelay();
        Duration pause = scaled(settings().getCooldown(), consecutiveFailures - 1, settings().getMaxCooldown());
        Instant deadline = clock.instant().plus(pause);
        if (deadline.isAfter(cooldownUntil)) {
            cooldownUntil = deadline;
        }
        log.warn("{} signal #{}: request delay now {} ms, global cooldown {} ms",
                outcome, consecutiveFailures, delay.toMillis(), pause.toMillis());
    }

    /** Per-request delay for the current failure count; the floor when nothing is failing. */
    private Duration currentDelay() {
        return scaled(settings().getBaseDelay(), consecutiveFailures, settings().getMaxDelay());
    }

    private Duration scaled(Duration base, int exponent, Duration ceiling) {
        double factor = Math.pow(Math.max(1.0, settings().getBackoffFactor()), Math.max(0, exponent));
        double millis = base.toMillis() * factor;
        if (millis >= ceiling.toMillis()) {
            return ceiling;
        }
        return Duration.ofMillis((long) millis);
    }

    private CatalogDownloaderProperties.Rate settings() {
        return properties.getRate();
    }
}
