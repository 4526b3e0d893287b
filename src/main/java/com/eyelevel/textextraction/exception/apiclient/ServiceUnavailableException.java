package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The external service could not be reached or is unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -559016420313820734L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
