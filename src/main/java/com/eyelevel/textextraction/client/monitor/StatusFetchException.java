package com.eyelevel.textextraction.client.monitor;

import lombok.Getter;

import java.io.Serial;

/**
 * Reading a document status over the network failed.
 */
@Getter
public class StatusFetchException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4127795063513416021L;

    /**
     * HTTP status of the response, null when no response arrived.
     */
    private final Integer statusCode;

    /**
     * Whether polling again later may succeed.
     */
    private final boolean transientFailure;

    public StatusFetchException(String message, Integer statusCode, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.transientFailure = transientFailure;
    }
}
