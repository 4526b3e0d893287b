package com.eyelevel.textextraction.error;

import com.eyelevel.textextraction.model.ErrorKind;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Guesses an {@link ErrorKind} from a free-text error message.
 *
 * <p>Only for errors that arrive without a structured code, such as records written before codes
 * existed or responses from older OCR service versions. Callers must prefer a structured kind whenever
 * one is available.
 */
public final class LegacyErrorMessageClassifier {

    // Checked in order; the first group with a matching keyword wins.
    private static final List<Map.Entry<ErrorKind, List<String>>> RULES = List.of(
            Map.entry(ErrorKind.INVALID_JOB_REFERENCE, List.of("invalid job", "job id", "expired")),
            Map.entry(ErrorKind.DOCUMENT_CORRUPTED, List.of("corrupt", "damaged", "invalid format")),
            Map.entry(ErrorKind.DOCUMENT_PROTECTED, List.of("password", "encrypted", "protected")),
            Map.entry(ErrorKind.DOCUMENT_TOO_LARGE, List.of("too large", "size limit", "file size")),
            Map.entry(ErrorKind.UNSUPPORTED_FORMAT, List.of("unsupported", "format not supported")),
            Map.entry(ErrorKind.EMPTY_RESULT, List.of("empty", "no text")),
            Map.entry(ErrorKind.TIMEOUT, List.of("timeout", "timed out")),
            Map.entry(ErrorKind.TRANSIENT_NETWORK_ERROR, List.of("network", "connection")));

    private LegacyErrorMessageClassifier() {
    }

    /**
     * @param message the raw error text, may be null
     * @return the best matching kind, {@link ErrorKind#EXTERNAL_SERVICE_ERROR} when nothing matches
     */
    public static ErrorKind classify(String message) {
        if (message == null || message.isBlank()) {
            return ErrorKind.EXTERNAL_SERVICE_ERROR;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return RULES.stream()
                    .filter(rule -> rule.getValue().stream().anyMatch(lower::contains))
                    .map(Map.Entry::getKey)
                    .findFirst()
                    .orElse(ErrorKind.EXTERNAL_SERVICE_ERROR);
    }
}
