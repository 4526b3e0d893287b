package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The external service is rate limiting this client (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6679087435118426732L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
