package com.cardintel.catalog.proxy;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

/**
 * Probes a route with a plain GET against the configured probe URL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HttpRouteProbe implements RouteProbe {

    private final RouteClientFactory clients;
    private final CatalogDownloaderProperties properties;

    @Override
    public boolean probe(String route) {
        String url = properties.getProxy().getProbeUrl();
        try {
            ResponseEntity<String> response = clients.executeProbe(route, rest -> rest.getForEntity(url, String.class));
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException e) {
            log.debug("Probe via {} failed: {}", route, e.getMessage());
            return false;
        }
    }
}
