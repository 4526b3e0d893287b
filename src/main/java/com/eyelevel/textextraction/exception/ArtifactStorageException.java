package com.eyelevel.textextraction.exception;

import java.io.Serial;

public class ArtifactStorageException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 4015262198763349011L;

    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
