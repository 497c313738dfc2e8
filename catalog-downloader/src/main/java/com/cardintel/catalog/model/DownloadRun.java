package com.cardintel.catalog.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each download run for observability.
 * Stored in the download_runs table in ClickHouse.
 */
@Data
@Builder
public class DownloadRun {

    private String runId;           // UUID
    private String mode;            // FRESH | RESUME | RETRY_FAILED | CATEGORY
    private String categories;      // comma-separated filter, null for all
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | PARTIAL | FAILED | INTERRUPTED
    private int nodesProcessed;
    private int nodesSkipped;
    private int nodesFailed;
    private int nodesPending;
    private long recordsWritten;
    private String errorMessage;    // null unless FAILED
}
