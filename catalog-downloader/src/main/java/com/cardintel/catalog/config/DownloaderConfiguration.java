package com.cardintel.catalog.config;

import com.cardintel.catalog.model.ProxyRecord;
import com.cardintel.catalog.proxy.ProxyControlClient;
import com.cardintel.catalog.proxy.ProxyPool;
import com.cardintel.catalog.proxy.RouteProbe;
import com.cardintel.catalog.service.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.List;

/**
 * Wires the time source, the pacing sleeper and the proxy pool.
 */
@Configuration
@Slf4j
public class DownloaderConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    /**
     * Candidate routes come from the control plane when it is enabled (falling back to
     * the configured list if it cannot be reached), otherwise from the configured list.
     * With proxies disabled the pool only holds the default route.
     */
    @Bean
    public ProxyPool proxyPool(CatalogDownloaderProperties properties,
                               ProxyControlClient controlClient,
                               RouteProbe routeProbe,
                               Clock clock) {
        CatalogDownloaderProperties.Proxy settings = properties.getProxy();
        List<ProxyRecord> candidates = List.of();
        if (settings.isEnabled()) {
            candidates = settings.getControlPlane().isEnabled()
                    ? controlPlaneRoutes(settings, controlClient)
                    : configuredRoutes(settings);
        }
        return new ProxyPool(settings, candidates, routeProbe, clock);
    }

    private List<ProxyRecord> controlPlaneRoutes(CatalogDownloaderProperties.Proxy settings,
                                                 ProxyControlClient controlClient) {
        try {
            String uri = settings.getControlPlane().getLocalProxyUri();
            return controlClient.listRoutes().stream()
                    .map(name -> ProxyRecord.builder().name(name).proxyUri(uri).build())
                    .toList();
        } catch (RestClientException e) {
            log.warn("Proxy control plane at {} unreachable ({}), using configured routes",
                    settings.getControlPlane().getUrl(), e.getMessage());
            return configuredRoutes(settings);
        }
    }

    private List<ProxyRecord> configuredRoutes(CatalogDownloaderProperties.Proxy settings) {
        return settings.getRoutes().stream()
                .map(r -> ProxyRecord.builder().name(r.getName()).proxyUri(r.getUri()).build())
                .toList();
    }
}
