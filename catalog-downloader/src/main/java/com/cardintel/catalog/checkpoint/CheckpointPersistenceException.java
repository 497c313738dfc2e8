package com.cardintel.catalog.checkpoint;

/**
 * A checkpoint transition could not be made durable. The run must stop: continuing
 * would leave it unclear which nodes were really completed.
 */
public class CheckpointPersistenceException extends RuntimeException {

    public CheckpointPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
