package com.cardintel.catalog.proxy;

/**
 * Lightweight liveness check for one egress route.
 */
@FunctionalInterface
public interface RouteProbe {

    /**
     * @return true if a probe request through the route succeeded
     */
    boolean probe(String route);
}
