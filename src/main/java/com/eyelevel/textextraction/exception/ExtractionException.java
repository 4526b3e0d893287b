package com.eyelevel.textextraction.exception;

import com.eyelevel.textextraction.model.ErrorKind;
import lombok.Getter;

import java.io.Serial;

/**
 * Raised by a synchronous extractor. The {@link ErrorKind} is decided where the failure is
 * understood best, so callers never have to inspect the message.
 */
@Getter
public class ExtractionException extends DocumentProcessingException {
    @Serial
    private static final long serialVersionUID = 7529130455062017395L;

    private final ErrorKind errorKind;

    public ExtractionException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
