package com.eyelevel.textextraction.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors returned by, or raised while calling, an external HTTP API.
 *
 * <p>The HTTP status code is kept so callers can tell a rejected request from a service that is
 * temporarily unable to answer.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = -1939120844627330167L;
    private final int statusCode;

    /**
     * @param message    A descriptive message, usually the response body.
     * @param statusCode The HTTP status code associated with the failure.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * Whether repeating the same call later may succeed: server-side failures and rate limiting.
     */
    public boolean isTransient() {
        return statusCode >= 500 || statusCode == 429;
    }
}
