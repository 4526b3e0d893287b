package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The requested resource does not exist on the external service (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2270544901837226145L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
