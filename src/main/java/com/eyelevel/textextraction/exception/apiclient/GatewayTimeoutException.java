package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The external service did not answer in time (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 4471933512960375728L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
