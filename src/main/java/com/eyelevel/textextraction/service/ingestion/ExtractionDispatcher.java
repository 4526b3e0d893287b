package com.eyelevel.textextraction.service.ingestion;

import com.eyelevel.textextraction.exception.ArtifactStorageException;
import com.eyelevel.textextraction.exception.ExtractionException;
import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.SourceKind;
import com.eyelevel.textextraction.service.extraction.TextExtractor;
import com.eyelevel.textextraction.service.extraction.TextExtractorFactory;
import com.eyelevel.textextraction.service.job.AsyncJobService;
import com.eyelevel.textextraction.service.job.JobSubmission;
import com.eyelevel.textextraction.service.storage.ArtifactStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends an artifact to the backend its format is routed to and reports what happened. Never throws
 * for backend failures; they come back as {@link DispatchOutcome.Type#FAILED}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionDispatcher {

    private final TextExtractorFactory textExtractorFactory;
    private final AsyncJobService asyncJobService;
    private final ArtifactStorage artifactStorage;

    /**
     * @param documentId id of the record being dispatched
     * @param fileName   original file name
     * @param format     resolved format
     * @param storageKey where the artifact is stored
     * @param content    the artifact bytes, or null to read them from storage
     */
    public DispatchOutcome dispatch(final String documentId, final String fileName, final DocumentFormat format,
                                    final String storageKey, final byte[] content) {
        if (format.getSourceKind() == SourceKind.SYNCHRONOUS_TEXT) {
            return extractInline(documentId, format, storageKey, content);
        }
        return submitJob(documentId, fileName, format, storageKey);
    }

    private DispatchOutcome extractInline(final String documentId, final DocumentFormat format,
                                          final String storageKey, final byte[] content) {
        final TextExtractor extractor = textExtractorFactory.getExtractor(format).orElse(null);
        if (extractor == null) {
            log.error("No extractor registered for synchronous format {}.", format.getCode());
            return DispatchOutcome.failed(ErrorInfo.of(ErrorKind.UNSUPPORTED_FORMAT));
        }
        try {
            final byte[] bytes = content != null ? content : artifactStorage.load(storageKey);
            final String text = extractor.extract(bytes, format);
            if (text == null || text.isBlank()) {
                log.info("Document {} produced no text.", documentId);
                return DispatchOutcome.failed(ErrorInfo.of(ErrorKind.EMPTY_RESULT));
            }
            return DispatchOutcome.completed(text);
        } catch (final ExtractionException e) {
            log.warn("Extraction of document {} failed ({}): {}", documentId, e.getErrorKind(), e.getMessage());
            return DispatchOutcome.failed(ErrorInfo.of(e.getErrorKind(), e.getMessage()));
        } catch (final ArtifactStorageException e) {
            return DispatchOutcome.failed(new ErrorInfo(ErrorKind.EXTERNAL_SERVICE_ERROR,
                                                        "The stored document could not be read.", true));
        }
    }

    private DispatchOutcome submitJob(final String documentId, final String fileName, final DocumentFormat format,
                                      final String storageKey) {
        try {
            final String sourceUrl = artifactStorage.presignedDownloadUrl(storageKey).toString();
            final String jobRef = asyncJobService.submit(new JobSubmission(documentId, fileName, format, sourceUrl));
            return DispatchOutcome.submitted(jobRef);
        } catch (final RuntimeException e) {
            // Resubmitting needs a new ingestion, so the error is not retryable.
            log.error("Submitting document {} to the OCR service failed.", documentId, e);
            return DispatchOutcome.failed(new ErrorInfo(ErrorKind.EXTERNAL_SERVICE_ERROR,
                                                        "The document could not be submitted for text extraction.",
                                                        false));
        }
    }
}
