package com.eyelevel.textextraction.dto.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Job status as reported by the OCR service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrJobStatusResponse(String jobId, String status, JobError error) {

    /**
     * Error payload of a failed job. {@code code} is the structured error code; older service versions
     * only send {@code message}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobError(String code, String message) {
    }
}
