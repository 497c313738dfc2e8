package com.cardintel.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-run traversal options.
 */
@Value
@Builder
public class FetchOptions {

    /** Number of workers fetching groups of a category in parallel */
    @Builder.Default
    int concurrency = 1;

    /** Failed nodes re-enter the run as pending */
    boolean retryFailed;

    /** Retry pass: only previously failed nodes are fetched, fresh pending work is left alone */
    boolean onlyFailed;

    public static FetchOptions defaults() {
        return FetchOptions.builder().build();
    }
}
