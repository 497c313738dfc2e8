package com.cardintel.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one fetcher run.
 *
 * processed/skipped/failed/pending count node decisions made during this run; the
 * checkpoint* fields are the partition of the whole checkpoint after the run.
 */
@Value
@Builder
public class FetchSummary {

    int processed;
    int skipped;
    int failed;
    int pending;
    long totalRecords;
    long requests;
    boolean interrupted;

    int checkpointCompleted;
    int checkpointPending;
    int checkpointFailed;

    public boolean hasUnresolvedFailures() {
        return failed > 0 || pending > 0 || checkpointFailed > 0 || checkpointPending > 0;
    }

    /** Anything left to do can be picked up by re-running against the same checkpoint. */
    public boolean isResumable() {
        return checkpointPending > 0 || checkpointFailed > 0 || interrupted;
    }
}
