package com.eyelevel.textextraction.dto.document;

import com.eyelevel.textextraction.model.DocumentStatus;

/**
 * Returned by an upload: the id to poll and the status the record was created in.
 */
public record IngestionResponse(String id, DocumentStatus status) {
}
