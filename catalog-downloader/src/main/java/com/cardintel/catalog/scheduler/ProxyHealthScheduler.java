package com.cardintel.catalog.scheduler;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.proxy.ProxyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Re-probes every proxy route while a download is running.
 *
 * Default interval: 10 minutes. Override with PROXY_HEALTH_CHECK_INTERVAL_MS or
 * catalog-downloader.proxy.health-check-interval-ms.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProxyHealthScheduler {

    private final ProxyPool proxyPool;
    private final CatalogDownloaderProperties properties;

    @Scheduled(
            fixedDelayString = "${catalog-downloader.proxy.health-check-interval-ms:600000}",
            initialDelayString = "${catalog-downloader.proxy.health-check-interval-ms:600000}")
    public void scheduledHealthCheck() {
        if (!properties.getProxy().isEnabled() || !proxyPool.hasCandidates()) {
            return;
        }
        try {
            Map<String, Boolean> results = proxyPool.healthCheckAll();
            log.debug("Scheduled health check results: {}", results);
        } catch (Exception e) {
            log.error("Scheduled proxy health check failed: {}", e.getMessage(), e);
        }
    }
}
