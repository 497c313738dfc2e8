package com.cardintel.catalog.proxy;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.ProxyRecord;
import com.cardintel.catalog.model.RequestOutcome;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health-scored set of egress routes.
 *
 * Selection: among routes whose last passing probe is inside the freshness window, take
 * the highest success ratio, then the fewest attempts. With nothing eligible, fall back
 * to the default route. A throttle or server error on the active route makes the next
 * selection skip that route if anything else is eligible.
 *
 * Health probes and traffic reports touch disjoint fields: probes never move the
 * success ratio, traffic never flips the health flag.
 */
@Slf4j
public class ProxyPool {

    private static final Comparator<ProxyRecord> RANKING = Comparator
            .comparingDouble(ProxyRecord::successRatio).reversed()
            .thenComparingLong(ProxyRecord::getAttempts);

    private final CatalogDownloaderProperties.Proxy settings;
    private final RouteProbe probe;
    private final Clock clock;
    private final String defaultRoute;

    // guarded by this
    private final Map<String, ProxyRecord> routes = new LinkedHashMap<>();
    private String activeRoute;
    private String avoidRoute;

    public ProxyPool(CatalogDownloaderProperties.Proxy settings,
                     List<ProxyRecord> candidates,
                     RouteProbe probe,
                     Clock clock) {
        this.settings = settings;
        this.probe = probe;
        this.clock = clock;
        this.defaultRoute = settings.getDefaultRoute();

        routes.put(defaultRoute, ProxyRecord.builder().name(defaultRoute).build());
        for (ProxyRecord candidate : candidates) {
            routes.putIfAbsent(candidate.getName(), candidate);
        }
        log.info("Proxy pool initialised with {} candidate routes (default: {})",
                routes.size() - 1, defaultRoute);
    }

    public synchronized String selectRoute() {
        Instant now = clock.instant();
        List<ProxyRecord> eligible = new ArrayList<>();
        for (ProxyRecord record : routes.values()) {
            if (!record.getName().equals(defaultRoute) && isEligible(record, now)) {
                eligible.add(record);
            }
        }

        if (avoidRoute != null) {
            String avoided = avoidRoute;
            if (eligible.stream().anyMatch(r -> !r.getName().equals(avoided))) {
                eligible.removeIf(r -> r.getName().equals(avoided));
            }
            avoidRoute = null;
        }

        String chosen = eligible.stream()
                .min(RANKING)
                .map(ProxyRecord::getName)
                .orElse(defaultRoute);

        if (!chosen.equals(activeRoute)) {
            log.info("Egress route {} → {}", activeRoute, chosen);
            activeRoute = chosen;
        }
        return chosen;
    }

    public synchronized void report(String route, RequestOutcome outcome) {
        ProxyRecord record = routes.get(route);
        if (record == null) {
            log.warn("Outcome reported for unknown route {}", route);
            return;
        }
        record.setAttempts(record.getAttempts() + 1);
        switch (outcome) {
            // a client error still means the route delivered a response
            case OK, CLIENT_ERROR -> record.setSuccesses(record.getSuccesses() + 1);
            case RATE_LIMITED -> record.setRateLimited(record.getRateLimited() + 1);
            case SERVER_ERROR -> record.setServerErrors(record.getServerErrors() + 1);
        }
        if (outcome.isThrottleSignal() && route.equals(activeRoute)) {
            log.warn("{} on active route {} (success ratio {}), reselecting on next request",
                    outcome, route, String.format("%.2f", record.successRatio()));
            avoidRoute = route;
        }
    }

    /**
     * Probe every candidate route independently and update its health flag.
     * Runs the probes outside the pool lock so traffic is not blocked.
     */
    public Map<String, Boolean> healthCheckAll() {
        List<String> names;
        synchronized (this) {
            names = routes.keySet().stream().filter(n -> !n.equals(defaultRoute)).toList();
        }
        log.info("Starting proxy health check of {} routes...", names.size());

        Map<String, Boolean> results = new LinkedHashMap<>();
        for (String name : names) {
            boolean passed;
            try {
                passed = probe.probe(name);
            } catch (RuntimeException e) {
                log.warn("Health check for {} failed: {}", name, e.getMessage());
                passed = false;
            }
            applyProbeResult(name, passed);
            results.put(name, passed);
        }

        long healthy = results.values().stream().filter(Boolean::booleanValue).count();
        log.info("Health check complete: {}/{} routes healthy", healthy, results.size());
        return results;
    }

    public synchronized boolean hasEligibleRoute() {
        Instant now = clock.instant();
        return routes.values().stream()
                .anyMatch(r -> !r.getName().equals(defaultRoute) && isEligible(r, now));
    }

    public synchronized boolean hasCandidates() {
        return routes.size() > 1;
    }

    /** Copies of every route's counters, default route first. */
    public synchronized List<ProxyRecord> statistics() {
        return routes.values().stream().map(r -> r.toBuilder().build()).toList();
    }

    public String getDefaultRoute() {
        return defaultRoute;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized void applyProbeResult(String name, boolean passed) {
        ProxyRecord record = routes.get(name);
        Instant now = clock.instant();
        record.setLastCheckedAt(now);
        if (passed) {
            if (Boolean.FALSE.equals(record.getHealthy())) {
                log.info("Route {} passed its health check and rejoins the pool", name);
            }
            record.setHealthy(true);
            record.setConsecutiveProbeFailures(0);
            record.setLastHealthyAt(now);
        } else {
            record.setConsecutiveProbeFailures(record.getConsecutiveProbeFailures() + 1);
            if (record.getHealthy() == null
                    || record.getConsecutiveProbeFailures() >= settings.getUnhealthyAfterProbeFailures()) {
                if (!Boolean.FALSE.equals(record.getHealthy())) {
                    log.warn("Route {} marked unhealthy after {} failed probe(s)",
                            name, record.getConsecutiveProbeFailures());
                }
                record.setHealthy(false);
            }
        }
    }

    private boolean isEligible(ProxyRecord record, Instant now) {
        return Boolean.TRUE.equals(record.getHealthy())
                && record.getLastHealthyAt() != null
                && !record.getLastHealthyAt().isBefore(now.minus(settings.getFreshnessWindow()));
    }
}
