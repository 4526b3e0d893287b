package com.eyelevel.textextraction.exception.json;

import java.io.Serial;

/**
 * Thrown when a JSON payload from an external service cannot be mapped onto the expected type.
 */
public class JsonParsingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5078810843318790012L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
