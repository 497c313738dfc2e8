package com.cardintel.catalog.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable download progress: one entry per discovered node plus run metadata.
 * Serialised as JSON by the file checkpoint store.
 */
@Data
@NoArgsConstructor
public class Checkpoint {

    public static final String CURRENT_VERSION = "2.0";

    private String version = CURRENT_VERSION;
    private Instant startedAt;
    private Instant lastUpdated;
    private long totalRecords;

    /** Node key → entry, in discovery order */
    private Map<String, NodeEntry> nodes = new LinkedHashMap<>();

    public static Checkpoint fresh(Instant now) {
        Checkpoint checkpoint = new Checkpoint();
        checkpoint.setStartedAt(now);
        checkpoint.setLastUpdated(now);
        return checkpoint;
    }

    /** Deep copy, so callers never share entries with the store. */
    public Checkpoint copy() {
        Checkpoint copy = new Checkpoint();
        copy.setVersion(version);
        copy.setStartedAt(startedAt);
        copy.setLastUpdated(lastUpdated);
        copy.setTotalRecords(totalRecords);
        nodes.forEach((key, entry) -> copy.getNodes().put(key, entry.toBuilder().build()));
        return copy;
    }

    @Data
    @Builder(toBuilder = true)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NodeEntry {
        private NodeLevel level;
        private String parentKey;
        private String name;
        private NodeState state;
        private int attempts;
        private String lastError;   // null unless the last attempt failed
        private Instant updatedAt;
    }
}
