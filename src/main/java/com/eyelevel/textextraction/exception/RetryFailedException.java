package com.eyelevel.textextraction.exception;

import java.io.Serial;

/**
 * Thrown when a retry is requested for a record that is not eligible for a new attempt cycle.
 */
public class RetryFailedException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 1L;

    public RetryFailedException(String message) {
        super(message);
    }
}
