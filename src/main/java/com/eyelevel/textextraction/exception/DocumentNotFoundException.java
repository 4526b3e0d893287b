package com.eyelevel.textextraction.exception;

import java.io.Serial;

public class DocumentNotFoundException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = -6124907738212554170L;

    public DocumentNotFoundException(String documentId) {
        super("Document with ID " + documentId + " not found.");
    }
}
