package com.eyelevel.textextraction.dto.document;

import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Client view of a document record. Backend details such as the job reference stay internal.
 *
 * @param extractedText present only when {@code status} is COMPLETED
 * @param errorInfo     present only when {@code status} is FAILED or TIMED_OUT
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentStatusResponse(String id, DocumentStatus status, String fileName, String format,
                                     String extractedText, ErrorInfoResponse errorInfo, Instant createdAt,
                                     Instant updatedAt) {

    public static DocumentStatusResponse from(final DocumentRecord record) {
        return new DocumentStatusResponse(record.getId(), record.getStatus(), record.getFileName(),
                                          record.getFormat(), record.getExtractedText(),
                                          ErrorInfoResponse.from(record.getErrorInfo()), record.getCreatedAt(),
                                          record.getUpdatedAt());
    }
}
