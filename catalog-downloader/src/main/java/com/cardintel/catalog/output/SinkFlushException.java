package com.cardintel.catalog.output;

/**
 * A batch could not be delivered to the warehouse after all retries.
 */
public class SinkFlushException extends RuntimeException {

    public SinkFlushException(String message, Throwable cause) {
        super(message, cause);
    }
}
