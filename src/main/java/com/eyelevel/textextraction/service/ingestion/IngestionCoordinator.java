package com.eyelevel.textextraction.service.ingestion;

import com.eyelevel.textextraction.config.ExtractionProperties;
import com.eyelevel.textextraction.exception.ArtifactStorageException;
import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.SourceKind;
import com.eyelevel.textextraction.service.record.DocumentRecordStore;
import com.eyelevel.textextraction.service.storage.ArtifactStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for new documents. Classifies the artifact, dispatches it, and creates exactly one
 * record already in its post-dispatch state, so no record is ever left in PENDING without a backend.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionCoordinator {

    private final FormatClassifier formatClassifier;
    private final ExtractionDispatcher extractionDispatcher;
    private final ArtifactStorage artifactStorage;
    private final DocumentRecordStore documentRecordStore;
    private final ExtractionProperties extractionProperties;
    private final Clock clock;

    /**
     * Ingests one artifact.
     *
     * @param command the uploaded artifact
     * @return the created record: COMPLETED or FAILED for synchronous formats and rejected uploads,
     * PROCESSING once an OCR job is attached
     */
    public DocumentRecord ingest(final IngestionCommand command) {
        final String documentId = UUID.randomUUID().toString();
        final Instant now = clock.instant();
        final byte[] content = command.content() == null ? new byte[0] : command.content();
        log.info("Ingesting '{}' ({} bytes) as document {}.", command.fileName(), content.length, documentId);

        final DocumentRecord.DocumentRecordBuilder record = DocumentRecord.builder()
                .id(documentId)
                .fileName(command.fileName())
                .sizeBytes(content.length)
                .attemptCount(0)
                .createdAt(now)
                .cycleStartedAt(now)
                .updatedAt(now);

        final Optional<DocumentFormat> classified = formatClassifier.classify(command);
        if (classified.isEmpty()) {
            return documentRecordStore.create(
                    failed(record.sourceKind(SourceKind.SYNCHRONOUS_TEXT), ErrorInfo.of(ErrorKind.UNSUPPORTED_FORMAT)));
        }
        final DocumentFormat format = classified.get();
        record.format(format.getCode()).sourceKind(format.getSourceKind());

        if (content.length > extractionProperties.getMaxFileSize().toBytes()) {
            log.info("Document {} exceeds the maximum size of {}.", documentId, extractionProperties.getMaxFileSize());
            return documentRecordStore.create(failed(record, ErrorInfo.of(ErrorKind.DOCUMENT_TOO_LARGE)));
        }

        final String storageKey;
        try {
            storageKey = artifactStorage.store(documentId, command.fileName(), format.getMimeType(), content);
        } catch (final ArtifactStorageException e) {
            return documentRecordStore.create(failed(record, new ErrorInfo(
                    ErrorKind.EXTERNAL_SERVICE_ERROR, "The document could not be stored for processing.", false)));
        }
        record.storageKey(storageKey);

        final DispatchOutcome outcome = extractionDispatcher.dispatch(documentId, command.fileName(), format,
                                                                      storageKey, content);
        return documentRecordStore.create(apply(record, outcome));
    }

    private static DocumentRecord apply(final DocumentRecord.DocumentRecordBuilder record,
                                        final DispatchOutcome outcome) {
        return switch (outcome.type()) {
            case COMPLETED -> record.status(DocumentStatus.COMPLETED).extractedText(outcome.extractedText()).build();
            case FAILED -> failed(record, outcome.errorInfo());
            case SUBMITTED -> record.status(DocumentStatus.PROCESSING).externalJobRef(outcome.externalJobRef()).build();
        };
    }

    private static DocumentRecord failed(final DocumentRecord.DocumentRecordBuilder record, final ErrorInfo errorInfo) {
        return record.status(DocumentStatus.FAILED)
                     .errorKind(errorInfo.kind())
                     .errorMessage(errorInfo.message())
                     .errorRetryable(errorInfo.retryable())
                     .build();
    }
}
