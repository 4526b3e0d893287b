package com.eyelevel.textextraction.service.ingestion;

/**
 * An uploaded artifact to ingest.
 *
 * @param fileName       original file name
 * @param declaredFormat format named by the caller, an extension or MIME type; may be null
 * @param contentType    content type of the upload part; may be null
 * @param content        the artifact bytes
 */
public record IngestionCommand(String fileName, String declaredFormat, String contentType, byte[] content) {
}
