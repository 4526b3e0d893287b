package com.eyelevel.textextraction.exception.apiclient;

import java.io.Serial;

/**
 * The external service rejected the request as malformed (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 8812203745539121086L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
