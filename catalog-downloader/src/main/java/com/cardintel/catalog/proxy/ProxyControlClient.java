package com.cardintel.catalog.proxy;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thin client over a Mihomo/Clash-style proxy controller.
 *
 *   GET /proxies          → {"proxies": {"name": {"type": "...", "now": "...", "all": [...]}}}
 *   GET /proxies/{group}  → {"now": "current-route", ...}
 *   PUT /proxies/{group}  ← {"name": "route"}
 *
 * Only used when catalog-downloader.proxy.control-plane.enabled=true.
 */
@Component
@Slf4j
public class ProxyControlClient {

    private static final Set<String> BUILT_IN = Set.of("DIRECT", "REJECT", "GLOBAL");
    private static final Set<String> ROUTE_TYPES = Set.of("Shadowsocks", "ShadowsocksR", "Vmess", "Trojan");

    private final RestTemplate restTemplate;
    private final CatalogDownloaderProperties.Proxy.ControlPlane settings;

    // guarded by this
    private String selectedRoute;

    @Autowired
    public ProxyControlClient(RestTemplateBuilder builder, CatalogDownloaderProperties properties) {
        this.settings = properties.getProxy().getControlPlane();
        RestTemplateBuilder configured = builder.rootUri(settings.getUrl());
        if (settings.getSecret() != null && !settings.getSecret().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getSecret());
        }
        this.restTemplate = configured.build();
    }

    ProxyControlClient(RestTemplate restTemplate, CatalogDownloaderProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getProxy().getControlPlane();
    }

    /**
     * Individual proxies known to the controller, excluding built-ins and selector groups.
     */
    @Retry(name = "proxyControl")
    public List<String> listRoutes() {
        JsonNode body = restTemplate.getForObject("/proxies", JsonNode.class);
        List<String> routes = new ArrayList<>();
        if (body == null || !body.has("proxies")) {
            return routes;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = body.get("proxies").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String type = entry.getValue().path("type").asText("");
            if (!BUILT_IN.contains(entry.getKey()) && ROUTE_TYPES.contains(type)) {
                routes.add(entry.getKey());
            }
        }
        log.info("Control plane lists {} routes", routes.size());
        return routes;
    }

    /** Route the selector group currently points at, or null if the controller does not say. */
    @Retry(name = "proxyControl")
    public String currentRoute() {
        JsonNode body = restTemplate.getForObject("/proxies/{group}", JsonNode.class, settings.getSelectorGroup());
        if (body == null || !body.hasNonNull("now")) {
            return null;
        }
        return body.get("now").asText();
    }

    /**
     * Point the selector group at the route unless it already is.
     * Serialised, since the selector is a single shared switch.
     */
    @Retry(name = "proxyControl")
    public synchronized void ensureSelected(String route) {
        if (route.equals(selectedRoute)) {
            return;
        }
        restTemplate.put("/proxies/{group}", Map.of("name", route), settings.getSelectorGroup());
        log.info("Control plane switched {} → {}", selectedRoute, route);
        selectedRoute = route;
    }
}
