package com.eyelevel.textextraction.model;

import java.util.Objects;

/**
 * Structured error stored on a record that ended in {@link DocumentStatus#FAILED} or
 * {@link DocumentStatus#TIMED_OUT}.
 *
 * @param kind      the error category
 * @param message   human readable description
 * @param retryable whether an explicit retry of the same artifact may succeed
 */
public record ErrorInfo(ErrorKind kind, String message, boolean retryable) {

    public ErrorInfo {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null || message.isBlank()) {
            message = kind.getDefaultMessage();
        }
    }

    public static ErrorInfo of(ErrorKind kind) {
        return new ErrorInfo(kind, kind.getDefaultMessage(), kind.isRetryable());
    }

    public static ErrorInfo of(ErrorKind kind, String message) {
        return new ErrorInfo(kind, message, kind.isRetryable());
    }
}
