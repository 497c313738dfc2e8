package com.cardintel.catalog.service;

import com.cardintel.catalog.config.CatalogDownloaderProperties;
import com.cardintel.catalog.model.RequestOutcome;
import com.cardintel.catalog.model.api.TcgCategory;
import com.cardintel.catalog.model.api.TcgGroup;
import com.cardintel.catalog.proxy.RouteClientFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Thin client over the catalog API (tcgcsv.com layout):
 *
 *   GET {base}/categories
 *   GET {base}/{categoryId}/groups
 *   GET {base}/{categoryId}/{groupId}/products   (or /prices)
 *
 * Every endpoint answers {"success": bool, "errors": [...], "results": [...]}.
 *
 * No pacing or retrying happens here: each call is one request through the given route,
 * and every failure surfaces as an {@link UpstreamRequestException} carrying its
 * classification, so the fetcher and rate governor own the retry policy.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CatalogApiClient {

    private final RouteClientFactory clients;
    private final ObjectMapper objectMapper;
    private final CatalogDownloaderProperties properties;

    public List<TcgCategory> fetchCategories(String route) {
        return convert(fetchResults(route, "/categories"), TcgCategory.class);
    }

    public List<TcgGroup> fetchGroups(String route, String categoryId) {
        return convert(fetchResults(route, "/" + categoryId + "/groups"), TcgGroup.class);
    }

    /**
     * Items of a group from the configured item endpoint, as raw JSON objects.
     */
    public List<JsonNode> fetchItems(String route, String categoryId, String groupId) {
        String endpoint = properties.getApi().getItemEndpoint().path();
        JsonNode results = fetchResults(route, "/" + categoryId + "/" + groupId + "/" + endpoint);
        List<JsonNode> items = new ArrayList<>(results.size());
        results.forEach(items::add);
        return items;
    }

    public String itemEndpointPath(String categoryId, String groupId) {
        return "/" + categoryId + "/" + groupId + "/" + properties.getApi().getItemEndpoint().path();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode fetchResults(String route, String path) {
        String url = properties.getApi().getBaseUrl() + path;
        log.debug("GET {} via {}", url, route);

        String body;
        try {
            body = clients.execute(route, rest -> rest.getForObject(url, String.class));
        } catch (RestClientException e) {
            throw classify(e, url, route);
        }

        if (body == null || body.isBlank()) {
            throw UpstreamRequestException.malformed("Empty response body from " + url);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, 200, false,
                    "Malformed JSON from " + url + ": " + e.getOriginalMessage(), e);
        }
        if (root.has("success") && !root.get("success").asBoolean(true)) {
            throw UpstreamRequestException.malformed("API reported failure for " + url + ": " + root.path("errors"));
        }
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            throw UpstreamRequestException.malformed("No results array in response from " + url);
        }
        log.debug("API returned {} results for {}", results.size(), url);
        return results;
    }

    private UpstreamRequestException classify(RestClientException e, String url, String route) {
        if (e instanceof HttpClientErrorException ce) {
            int status = ce.getStatusCode().value();
            if (properties.getApi().getRateLimitStatusCodes().contains(status)) {
                log.warn("Rate limited (HTTP {}) via {} for {}", status, route, url);
                return new UpstreamRequestException(RequestOutcome.RATE_LIMITED, status, false,
                        "Rate limited (HTTP " + status + ")", e);
            }
            return new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, status, false,
                    "HTTP " + status + " for " + url, e);
        }
        if (e instanceof HttpServerErrorException se) {
            int status = se.getStatusCode().value();
            log.warn("Server error (HTTP {}) via {} for {}", status, route, url);
            return new UpstreamRequestException(RequestOutcome.SERVER_ERROR, status, false,
                    "Server error (HTTP " + status + ")", e);
        }
        if (e instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            return new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, status, false,
                    "Unexpected HTTP " + status + " for " + url, e);
        }
        if (e instanceof ResourceAccessException) {
            log.warn("Transport failure via {} for {}: {}", route, url, e.getMessage());
            return new UpstreamRequestException(RequestOutcome.SERVER_ERROR, 0, true,
                    "Transport failure: " + e.getMessage(), e);
        }
        // body conversion problems and anything else the client could not read
        return new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, 0, false,
                "Unreadable response from " + url + ": " + e.getMessage(), e);
    }

    private <T> List<T> convert(JsonNode results, Class<T> type) {
        List<T> items = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            try {
                items.add(objectMapper.treeToValue(node, type));
            } catch (JsonProcessingException e) {
                throw new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, 200, false,
                        "Schema mismatch for " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
            }
        }
        return items;
    }
}
