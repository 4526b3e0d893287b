package com.eyelevel.textextraction.service.storage;

import java.net.URL;

/**
 * Keeps the original bytes of every ingested artifact so that it can be handed to the OCR service and
 * re-dispatched by a retry.
 */
public interface ArtifactStorage {

    /**
     * Stores the artifact and returns the key it was stored under.
     *
     * @throws com.eyelevel.textextraction.exception.ArtifactStorageException if the write fails
     */
    String store(String documentId, String fileName, String contentType, byte[] content);

    /**
     * @throws com.eyelevel.textextraction.exception.ArtifactStorageException if the object cannot be read
     */
    byte[] load(String storageKey);

    /**
     * A time-limited URL the OCR service can download the artifact from.
     */
    URL presignedDownloadUrl(String storageKey);
}
