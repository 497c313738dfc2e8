package com.cardintel.catalog.service;

import com.cardintel.catalog.model.RequestOutcome;
import lombok.Getter;

/**
 * A catalog API request that did not produce a usable result, already classified.
 */
@Getter
public class UpstreamRequestException extends RuntimeException {

    private final RequestOutcome outcome;

    /** HTTP status, or 0 when no response was received */
    private final int statusCode;

    /** True for timeouts, resets and other failures below HTTP */
    private final boolean transport;

    public UpstreamRequestException(RequestOutcome outcome, int statusCode, boolean transport,
                                    String message, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
        this.statusCode = statusCode;
        this.transport = transport;
    }

    public static UpstreamRequestException malformed(String message) {
        return new UpstreamRequestException(RequestOutcome.CLIENT_ERROR, 200, false, message, null);
    }
}
