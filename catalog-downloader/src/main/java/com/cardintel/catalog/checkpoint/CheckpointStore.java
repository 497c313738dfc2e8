package com.cardintel.catalog.checkpoint;

import com.cardintel.catalog.model.Checkpoint;
import com.cardintel.catalog.model.HierarchyNode;
import com.cardintel.catalog.model.NodeState;

import java.util.List;

/**
 * Durable per-node download state.
 *
 * Every mutating call has been persisted by the time it returns, or it throws
 * {@link CheckpointPersistenceException}.
 */
public interface CheckpointStore {

    /**
     * Read the checkpoint from storage. Nodes left IN_PROGRESS by a previous process
     * are returned to PENDING, since their partial results were never committed.
     */
    Checkpoint load();

    /** Replace the checkpoint with an empty one, keeping the previous one as a backup. */
    Checkpoint reset();

    /** Record a newly discovered node as PENDING. No-op if the node is already known. */
    void register(HierarchyNode node);

    /** {@link #register} for a batch of siblings, persisted once. */
    void registerAll(List<HierarchyNode> nodes);

    /**
     * Atomically move a node from PENDING to IN_PROGRESS.
     *
     * @return false if the node is not pending (already claimed, completed or failed)
     */
    boolean claim(String key);

    /**
     * Move a node to a new state.
     *
     * @throws IllegalStateException for a transition the state machine does not allow
     */
    void mark(String key, NodeState state);

    /** Attach the last error to a node without changing its state. */
    void recordError(String key, String message);

    /** Add to the running record total kept with the checkpoint. */
    void addRecords(long count);

    boolean isCompleted(String key);

    boolean isFailed(String key);

    NodeState stateOf(String key);

    /**
     * Children of {@code parentKey} still to be fetched: PENDING nodes, plus FAILED ones
     * when {@code includeFailed} is set.
     */
    List<String> pendingNodes(String parentKey, boolean includeFailed);

    List<String> failedNodes(String parentKey);

    /** Whether any child of {@code parentKey} is FAILED. */
    boolean hasFailedChildren(String parentKey);

    CheckpointPartition partition();

    /** Defensive copy of the current checkpoint. */
    Checkpoint snapshot();
}
