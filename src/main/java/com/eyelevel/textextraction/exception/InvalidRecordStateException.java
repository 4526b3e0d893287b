package com.eyelevel.textextraction.exception;

import java.io.Serial;

/**
 * Thrown when a write would break the document record lifecycle, for example changing a record that
 * already reached a terminal status.
 */
public class InvalidRecordStateException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -3170945521893467762L;

    public InvalidRecordStateException(String message) {
        super(message);
    }
}
