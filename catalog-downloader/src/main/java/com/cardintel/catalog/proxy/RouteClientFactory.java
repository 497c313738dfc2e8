package com.cardintel.catalog.proxy;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Builds and caches one {@link RestTemplate} per egress route.
 *
 * Routes come in three shapes:
 *  - the default route (normally DIRECT): no proxy
 *  - a configured route: its own http://host:port proxy
 *  - a control-plane route: the control plane's shared local port, behind a selector that
 *    has to point at the route for as long as the request is in flight
 *
 * Control-plane exchanges (traffic and probes alike) therefore run one at a time under a
 * single selector lock. The default route and plain configured routes never take it.
 */
@Component
@Slf4j
public class RouteClientFactory {

    private final RestTemplateBuilder builder;
    private final CatalogDownloaderProperties properties;
    private final ProxyControlClient controlClient;

    private final Map<String, RestTemplate> trafficClients = new ConcurrentHashMap<>();
    private final Map<String, RestTemplate> probeClients = new ConcurrentHashMap<>();
    private final ReentrantLock selectorLock = new ReentrantLock();

    public RouteClientFactory(RestTemplateBuilder builder,
                              CatalogDownloaderProperties properties,
                              ProxyControlClient controlClient) {
        this.builder = builder;
        this.properties = properties;
        this.controlClient = controlClient;
    }

    /** Run one catalog API exchange through the given route. */
    public <T> T execute(String route, Function<RestTemplate, T> exchange) {
        return onRoute(route, exchange, trafficClient(route));
    }

    /** Run one health probe through the given route, with the shorter probe timeout. */
    public <T> T executeProbe(String route, Function<RestTemplate, T> exchange) {
        return onRoute(route, exchange, probeClient(route));
    }

    RestTemplate trafficClient(String route) {
        return trafficClients.computeIfAbsent(route, r -> build(r,
                properties.getApi().getConnectTimeout(), properties.getApi().getReadTimeout()));
    }

    RestTemplate probeClient(String route) {
        Duration timeout = properties.getProxy().getProbeTimeout();
        return probeClients.computeIfAbsent(route, r -> build(r, timeout, timeout));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> T onRoute(String route, Function<RestTemplate, T> exchange, RestTemplate client) {
        if (!properties.getProxy().getControlPlane().isEnabled() || isDefaultRoute(route)) {
            return exchange.apply(client);
        }
        selectorLock.lock();
        try {
            controlClient.ensureSelected(route);
            return exchange.apply(client);
        } finally {
            selectorLock.unlock();
        }
    }

    private RestTemplate build(String route, Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());

        String proxyUri = resolveProxyUri(route);
        if (proxyUri != null) {
            URI uri = URI.create(proxyUri);
            requestFactory.setProxy(new Proxy(Proxy.Type.HTTP,
                    new InetSocketAddress(uri.getHost(), uri.getPort())));
            log.debug("Route {} → proxy {}", route, proxyUri);
        } else {
            log.debug("Route {} → direct", route);
        }

        return builder
                .requestFactory(() -> requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getApi().getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    String resolveProxyUri(String route) {
        if (isDefaultRoute(route)) {
            return null;
        }
        CatalogDownloaderProperties.Proxy proxy = properties.getProxy();
        if (proxy.getControlPlane().isEnabled()) {
            return proxy.getControlPlane().getLocalProxyUri();
        }
        return proxy.getRoutes().stream()
                .filter(r -> route.equals(r.getName()))
                .map(CatalogDownloaderProperties.Proxy.Route::getUri)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown route: " + route));
    }

    private boolean isDefaultRoute(String route) {
        return route.equals(properties.getProxy().getDefaultRoute());
    }
}
