package com.eyelevel.textextraction.exception;

import java.io.Serial;

/**
 * Base exception for errors raised while ingesting, extracting or tracking a document.
 */
public class DocumentProcessingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2291187305630934416L;

    public DocumentProcessingException(String message) {
        super(message);
    }

    public DocumentProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
