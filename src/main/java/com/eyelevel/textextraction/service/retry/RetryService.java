package com.eyelevel.textextraction.service.retry;

import com.eyelevel.textextraction.exception.DocumentNotFoundException;
import com.eyelevel.textextraction.exception.RetryFailedException;
import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.service.ingestion.DispatchOutcome;
import com.eyelevel.textextraction.service.ingestion.ExtractionDispatcher;
import com.eyelevel.textextraction.service.record.DocumentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Starts a new processing cycle for a record that ended with a retryable error.
 *
 * <p>The record is first moved back to PENDING with a compare-and-set, which makes concurrent retry
 * requests for the same record race for a single winner. The stored artifact is then dispatched again
 * and the outcome written with a second compare-and-set.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetryService {

    private final DocumentRecordStore documentRecordStore;
    private final ExtractionDispatcher extractionDispatcher;
    private final Clock clock;

    public DocumentRecord retry(final String documentId) {
        log.info("Attempting to retry document {}.", documentId);
        final DocumentRecord current = documentRecordStore.read(documentId)
                                                          .orElseThrow(() -> new DocumentNotFoundException(documentId));
        validateRetryable(current);
        final DocumentFormat format = current.resolveFormat()
                                             .orElseThrow(() -> new RetryFailedException(
                                                     "Cannot retry: document " + documentId + " has no known format."));

        final DocumentRecord pending = documentRecordStore.compareAndUpdate(current, RecordPatch.retry(), clock.instant())
                                                          .orElseThrow(() -> new RetryFailedException(
                                                                  "Cannot retry: document " + documentId +
                                                                  " was modified concurrently."));

        final DispatchOutcome outcome = extractionDispatcher.dispatch(pending.getId(), pending.getFileName(), format,
                                                                      pending.getStorageKey(), null);
        return documentRecordStore.compareAndUpdate(pending, outcome.toPatch(), clock.instant())
                                  .orElseGet(() -> {
                                      // Only a reconciliation pass could have touched a PENDING record; report
                                      // whatever it left behind.
                                      log.warn("Document {} changed while its retry was dispatched.", documentId);
                                      return documentRecordStore.read(documentId).orElse(pending);
                                  });
    }

    private static void validateRetryable(final DocumentRecord record) {
        if (record.getStatus() != DocumentStatus.FAILED && record.getStatus() != DocumentStatus.TIMED_OUT) {
            throw new RetryFailedException("Cannot retry: document is not in a FAILED or TIMED_OUT state. " +
                                           "Current state: " + record.getStatus());
        }
        final ErrorInfo errorInfo = record.getErrorInfo();
        if (errorInfo == null || !errorInfo.retryable()) {
            throw new RetryFailedException("Cannot retry: the error of document " + record.getId() +
                                           " is not retryable" +
                                           (errorInfo == null ? "." : " (" + errorInfo.kind() + ")."));
        }
        if (record.getStorageKey() == null) {
            throw new RetryFailedException("Cannot retry: no stored artifact exists for document " + record.getId());
        }
    }
}
