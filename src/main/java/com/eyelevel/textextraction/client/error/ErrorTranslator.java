package com.eyelevel.textextraction.client.error;

import com.eyelevel.textextraction.client.monitor.StatusFetchException;
import com.eyelevel.textextraction.dto.document.ErrorInfoResponse;
import com.eyelevel.textextraction.error.LegacyErrorMessageClassifier;
import com.eyelevel.textextraction.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps backend error payloads and transport failures to {@link UserFacingError}s.
 *
 * <p>A structured {@link ErrorKind} always decides the category. Message inspection through
 * {@link LegacyErrorMessageClassifier} only happens for payloads that carry no kind.
 */
@Slf4j
public class ErrorTranslator {

    private static final Map<ErrorKind, UserErrorCategory> CATEGORIES = new EnumMap<>(ErrorKind.class);

    static {
        CATEGORIES.put(ErrorKind.UNSUPPORTED_FORMAT, UserErrorCategory.UNSUPPORTED_FILE);
        CATEGORIES.put(ErrorKind.INVALID_JOB_REFERENCE, UserErrorCategory.SESSION_EXPIRED);
        CATEGORIES.put(ErrorKind.EXTERNAL_SERVICE_ERROR, UserErrorCategory.SERVICE_UNAVAILABLE);
        CATEGORIES.put(ErrorKind.TRANSIENT_NETWORK_ERROR, UserErrorCategory.CONNECTION_PROBLEM);
        CATEGORIES.put(ErrorKind.TIMEOUT, UserErrorCategory.PROCESSING_TIMEOUT);
        CATEGORIES.put(ErrorKind.EMPTY_RESULT, UserErrorCategory.NO_TEXT_FOUND);
        CATEGORIES.put(ErrorKind.DOCUMENT_CORRUPTED, UserErrorCategory.FILE_DAMAGED);
        CATEGORIES.put(ErrorKind.DOCUMENT_PROTECTED, UserErrorCategory.FILE_PROTECTED);
        CATEGORIES.put(ErrorKind.DOCUMENT_TOO_LARGE, UserErrorCategory.FILE_TOO_LARGE);
    }

    /**
     * Translates the error of a FAILED or TIMED_OUT record.
     */
    public UserFacingError translate(final ErrorInfoResponse errorInfo) {
        if (errorInfo == null) {
            return unknown("Text extraction failed without error details.");
        }
        if (errorInfo.kind() != null) {
            return fromKind(errorInfo.kind(), errorInfo.message(), errorInfo.retryable());
        }
        final ErrorKind guessed = LegacyErrorMessageClassifier.classify(errorInfo.message());
        log.debug("Error without a kind classified as {} from message '{}'.", guessed, errorInfo.message());
        return fromKind(guessed, errorInfo.message(), guessed.isRetryable());
    }

    /**
     * Translates a failure to read the status itself.
     */
    public UserFacingError translateTransport(final Throwable error) {
        if (error instanceof StatusFetchException fetchError) {
            final Integer statusCode = fetchError.getStatusCode();
            if (statusCode == null && fetchError.isTransientFailure()) {
                return new UserFacingError(UserErrorCategory.CONNECTION_PROBLEM,
                                           "Network connection error occurred. Please check your internet connection.",
                                           ErrorKind.TRANSIENT_NETWORK_ERROR.getRemediationHint(), true, null);
            }
            if (statusCode != null && statusCode == 404) {
                return new UserFacingError(UserErrorCategory.DOCUMENT_NOT_FOUND,
                                           "The document could not be found.",
                                           "Please upload the document again.", false, null);
            }
            if (fetchError.isTransientFailure()) {
                return new UserFacingError(UserErrorCategory.SERVICE_UNAVAILABLE,
                                           "The server is temporarily unavailable.",
                                           ErrorKind.EXTERNAL_SERVICE_ERROR.getRemediationHint(), true, null);
            }
        }
        return unknown(error.getMessage());
    }

    /**
     * The monitoring session ran out before the document reached a terminal status.
     */
    public UserFacingError clientTimeout(final Duration maxSessionDuration) {
        return new UserFacingError(UserErrorCategory.MONITORING_TIMEOUT,
                                   String.format("Text extraction monitoring timed out after %d minutes. "
                                                 + "The job may still be processing in the background.",
                                                 maxSessionDuration.toMinutes()),
                                   "Check the document status again later.", false, null);
    }

    private static UserFacingError fromKind(final ErrorKind kind, final String message, final boolean retryable) {
        final String text = message == null || message.isBlank() ? kind.getDefaultMessage() : message;
        return new UserFacingError(CATEGORIES.getOrDefault(kind, UserErrorCategory.UNKNOWN), text,
                                   kind.getRemediationHint(), retryable, kind);
    }

    private static UserFacingError unknown(final String message) {
        return new UserFacingError(UserErrorCategory.UNKNOWN,
                                   message == null || message.isBlank()
                                   ? "An unexpected error occurred during text extraction." : message,
                                   "Try again, or contact support if the problem persists.", true, null);
    }
}
