package com.cardintel.catalog.model;

/**
 * Per-node download state as recorded in the checkpoint.
 *
 * COMPLETED is terminal. FAILED only goes back to PENDING on an explicit retry request.
 */
public enum NodeState {
    PENDING, IN_PROGRESS, COMPLETED, FAILED;

    public boolean canTransitionTo(NodeState next) {
        return switch (this) {
            case PENDING -> next == IN_PROGRESS || next == COMPLETED || next == FAILED;
            case IN_PROGRESS -> next == COMPLETED || next == FAILED || next == PENDING;
            case FAILED -> next == PENDING;
            case COMPLETED -> false;
        };
    }
}
