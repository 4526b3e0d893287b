package com.eyelevel.textextraction.service.job;

import lombok.Getter;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Job states reported by the OCR service, with the wire values each one accepts.
 */
@Getter
public enum ExternalJobStatus {
    IN_PROGRESS("in_progress", "queued", "submitted", "running", "processing"),
    SUCCEEDED("succeeded", "completed", "complete"),
    FAILED("failed", "error"),
    /**
     * The service does not know the job yet, typically right after submission.
     */
    NOT_FOUND("not_found"),
    /**
     * The reference is malformed or has expired and will never resolve.
     */
    INVALID_JOB("invalid_job", "invalid_job_id", "expired");

    private static final Map<String, ExternalJobStatus> VALUE_MAP = Stream.of(values())
            .flatMap(status -> status.values.stream().map(value -> Map.entry(value, status)))
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));

    private final Set<String> values;

    ExternalJobStatus(String... values) {
        this.values = Set.of(values);
    }

    /**
     * Converts a wire value. Unknown values map to {@code IN_PROGRESS} so that the record keeps being
     * tracked until it succeeds, fails or times out.
     *
     * @param value status string from the service, case-insensitive
     * @return the matching status, {@code IN_PROGRESS} as a fallback
     */
    public static ExternalJobStatus convertByValue(String value) {
        if (value == null) {
            return IN_PROGRESS;
        }
        return VALUE_MAP.getOrDefault(value.trim().toLowerCase(Locale.ROOT), IN_PROGRESS);
    }
}
