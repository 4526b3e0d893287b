package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The requested resource existed but has expired on the external service (HTTP 410).
 */
public class GoneException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3346610251187240051L;

    public GoneException(String message) {
        super(message, 410);
    }
}
