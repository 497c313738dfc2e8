package com.cardintel.catalog.checkpoint;

/**
 * Node counts by state across a whole checkpoint.
 */
public record CheckpointPartition(int pending, int inProgress, int completed, int failed) {

    public int total() {
        return pending + inProgress + completed + failed;
    }
}
