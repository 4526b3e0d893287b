package com.eyelevel.textextraction.service.reconciliation;

import com.eyelevel.textextraction.error.LegacyErrorMessageClassifier;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns the error payload of a failed OCR job into a persisted {@link ErrorInfo}.
 *
 * <p>The structured error code decides the kind. The message text is only inspected when the service
 * sent no code, or one this translator does not know.
 */
@Slf4j
@Component
public class JobErrorTranslator {

    private static final Map<String, ErrorKind> CODE_MAP = Map.ofEntries(
            Map.entry("UNSUPPORTED_FORMAT", ErrorKind.UNSUPPORTED_FORMAT),
            Map.entry("INVALID_JOB", ErrorKind.INVALID_JOB_REFERENCE),
            Map.entry("INVALID_JOB_REFERENCE", ErrorKind.INVALID_JOB_REFERENCE),
            Map.entry("DOCUMENT_CORRUPTED", ErrorKind.DOCUMENT_CORRUPTED),
            Map.entry("DOCUMENT_ENCRYPTED", ErrorKind.DOCUMENT_PROTECTED),
            Map.entry("DOCUMENT_PROTECTED", ErrorKind.DOCUMENT_PROTECTED),
            Map.entry("DOCUMENT_TOO_LARGE", ErrorKind.DOCUMENT_TOO_LARGE),
            Map.entry("EMPTY_DOCUMENT", ErrorKind.EMPTY_RESULT),
            Map.entry("EMPTY_RESULT", ErrorKind.EMPTY_RESULT),
            Map.entry("TIMEOUT", ErrorKind.TIMEOUT),
            Map.entry("PROCESSING_TIMEOUT", ErrorKind.TIMEOUT),
            Map.entry("SERVICE_ERROR", ErrorKind.EXTERNAL_SERVICE_ERROR),
            Map.entry("INTERNAL_ERROR", ErrorKind.EXTERNAL_SERVICE_ERROR),
            Map.entry("JOB_FAILED", ErrorKind.EXTERNAL_SERVICE_ERROR));

    public ErrorInfo translate(final String errorCode, final String errorMessage) {
        final ErrorKind kind = fromCode(errorCode).orElseGet(() -> {
            log.debug("No structured code on job error (code: {}), classifying message.", errorCode);
            final ErrorKind classified = LegacyErrorMessageClassifier.classify(errorMessage);
            return classified.isPersistable() ? classified : ErrorKind.EXTERNAL_SERVICE_ERROR;
        });
        return ErrorInfo.of(kind, errorMessage);
    }

    private static Optional<ErrorKind> fromCode(final String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(CODE_MAP.get(errorCode.trim().toUpperCase(Locale.ROOT)));
    }
}
