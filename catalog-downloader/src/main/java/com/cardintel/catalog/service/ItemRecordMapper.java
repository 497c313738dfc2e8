package com.cardintel.catalog.service;

import com.cardintel.catalog.model.CatalogItemRecord;
import com.cardintel.catalog.model.HierarchyNode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Maps raw product / price objects from the catalog API to warehouse rows.
 */
@Component
@Slf4j
public class ItemRecordMapper {

    /**
     * @param group          the group node the item was fetched for (its parent chain names the category)
     * @param categoryName   display name of the owning category
     * @param item           one element of the API's results array
     * @param sourceEndpoint the API path used (for lineage tracking)
     * @throws UpstreamRequestException classified as a client error when the element is not
     *         an object with a numeric productId
     */
    public CatalogItemRecord map(HierarchyNode group, String categoryName, JsonNode item, String sourceEndpoint) {
        if (item == null || !item.isObject()) {
            throw UpstreamRequestException.malformed("Schema mismatch in " + sourceEndpoint
                    + ": expected an item object, got " + (item == null ? "nothing" : item.getNodeType()));
        }
        JsonNode productId = item.path("productId");
        if (!productId.isIntegralNumber() || !productId.canConvertToLong()) {
            throw UpstreamRequestException.malformed("Schema mismatch in " + sourceEndpoint
                    + ": item without a numeric productId");
        }
        LocalDateTime now = LocalDateTime.now();

        JsonNode extended = item.get("extendedData");
        String extendedData = extended != null && !extended.isNull() && extended.size() > 0
                ? extended.toString()
                : null;

        return CatalogItemRecord.builder()
                .categoryId(parseInt(group.categoryId()))
                .categoryName(categoryName)
                .groupId(parseInt(group.externalId()))
                .groupName(group.name())
                .productId(productId.asLong())
                .productName(text(item, "name"))
                .cleanName(text(item, "cleanName"))
                .imageUrl(text(item, "imageUrl"))
                .productUrl(text(item, "url"))
                .modifiedOn(text(item, "modifiedOn"))
                .extendedData(extendedData)
                .subTypeName(text(item, "subTypeName"))
                .lowPrice(decimal(item, "lowPrice"))
                .midPrice(decimal(item, "midPrice"))
                .highPrice(decimal(item, "highPrice"))
                .marketPrice(decimal(item, "marketPrice"))
                .directLowPrice(decimal(item, "directLowPrice"))
                .updateDate(LocalDate.now())
                .fetchedAt(now)
                .sourceEndpoint(sourceEndpoint)
                .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText();
        return s.isBlank() ? null : s;
    }

    private BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (value.isNumber()) return value.decimalValue();
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric {} value '{}'", field, value.asText());
            return null;
        }
    }

    private Integer parseInt(String val) {
        try {
            return Integer.valueOf(val);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
