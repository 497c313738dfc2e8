package com.cardintel.catalog.model;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Flat warehouse row: one catalog item, or one price observation, with its
 * category and group denormalised onto it.
 *
 * Product endpoint rows leave the price columns null; price endpoint rows leave
 * the descriptive product columns null.
 */
@Data
@Builder
public class CatalogItemRecord {

    // ── Hierarchy ───────────────────────────────────────────────────────────
    private Integer categoryId;
    private String categoryName;
    private Integer groupId;
    private String groupName;

    // ── Product ─────────────────────────────────────────────────────────────
    private Long productId;
    private String productName;
    private String cleanName;
    private String imageUrl;
    private String productUrl;
    private String modifiedOn;

    /** extendedData array from the API, kept as JSON text */
    private String extendedData;

    // ── Price ───────────────────────────────────────────────────────────────
    /** e.g. Normal, Holofoil, Reverse Holofoil */
    private String subTypeName;
    private BigDecimal lowPrice;
    private BigDecimal midPrice;
    private BigDecimal highPrice;
    private BigDecimal marketPrice;
    private BigDecimal directLowPrice;

    // ── Metadata ────────────────────────────────────────────────────────────
    /** Partition date in the warehouse */
    private LocalDate updateDate;
    private LocalDateTime fetchedAt;
    private String sourceEndpoint;

    /** Rough in-memory size, used for the byte bound of a batch. */
    public long estimatedBytes() {
        long size = 128;
        size += len(categoryName) + len(groupName) + len(productName) + len(cleanName);
        size += len(imageUrl) + len(productUrl) + len(modifiedOn) + len(extendedData);
        size += len(subTypeName) + len(sourceEndpoint);
        return size;
    }

    private static int len(String s) {
        return s == null ? 0 : s.length() * 2;
    }
}
