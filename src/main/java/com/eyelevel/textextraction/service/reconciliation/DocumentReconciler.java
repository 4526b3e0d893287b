package com.eyelevel.textextraction.service.reconciliation;

import com.eyelevel.textextraction.config.ExtractionProperties;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.model.SourceKind;
import com.eyelevel.textextraction.service.job.AsyncJobService;
import com.eyelevel.textextraction.service.job.JobPollResult;
import com.eyelevel.textextraction.service.record.DocumentRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Moves every active asynchronous record toward a terminal status by polling its OCR job.
 *
 * <p>A pass keeps no state between invocations and takes no locks. Passes may overlap: every write is
 * a compare-and-set against the state this pass read, and a pass that loses the race drops the record.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentReconciler {

    private final DocumentRecordStore documentRecordStore;
    private final AsyncJobService asyncJobService;
    private final JobErrorTranslator jobErrorTranslator;
    private final ExtractionProperties extractionProperties;
    private final Clock clock;

    /**
     * Runs one reconciliation pass over all PENDING and PROCESSING asynchronous records. A failure on one
     * record is logged and counted; it never stops the pass.
     *
     * @return the counts of this pass
     */
    public ReconciliationSummary reconcile() {
        final Instant passStartedAt = clock.instant();
        final List<DocumentRecord> records = documentRecordStore.queryByStatus(DocumentStatus.ACTIVE_STATUSES,
                                                                               SourceKind.ASYNCHRONOUS_JOB);
        log.info("Found {} active asynchronous records to reconcile.", records.size());

        final Map<RecordOutcome, Integer> outcomes = new EnumMap<>(RecordOutcome.class);
        for (final DocumentRecord record : records) {
            RecordOutcome outcome;
            try {
                outcome = reconcileRecord(record);
            } catch (final Exception e) {
                log.error("Unexpected error while reconciling record {}.", record.getId(), e);
                outcome = RecordOutcome.ERROR;
            }
            outcomes.merge(outcome, 1, Integer::sum);
        }

        final ReconciliationSummary summary = ReconciliationSummary.of(
                records.size(), outcomes, Duration.between(passStartedAt, clock.instant()));
        log.info("Reconciliation pass finished: {}", summary);
        return summary;
    }

    RecordOutcome reconcileRecord(final DocumentRecord record) {
        final Instant now = clock.instant();
        final Duration elapsed = Duration.between(record.getCycleStartedAt(), now);

        if (elapsed.compareTo(extractionProperties.getTimeoutThreshold()) > 0) {
            log.warn("Record {} exceeded the timeout of {} (elapsed {}).", record.getId(),
                     extractionProperties.getTimeoutThreshold(), elapsed);
            return write(record, RecordPatch.timeOut(timeoutError()), RecordOutcome.TIMED_OUT);
        }
        if (record.getExternalJobRef() == null) {
            log.debug("Record {} has no job attached yet, skipping.", record.getId());
            return RecordOutcome.SKIPPED;
        }

        final JobPollResult poll;
        try {
            poll = asyncJobService.poll(record.getExternalJobRef());
        } catch (final RuntimeException e) {
            return handlePollError(record, e);
        }

        return switch (poll.status()) {
            case SUCCEEDED -> completeFromResult(record);
            case FAILED -> {
                final ErrorInfo errorInfo = jobErrorTranslator.translate(poll.errorCode(), poll.errorMessage());
                log.info("OCR job {} of record {} failed with {}.", record.getExternalJobRef(), record.getId(),
                         errorInfo.kind());
                yield write(record, RecordPatch.fail(errorInfo, true), RecordOutcome.FAILED);
            }
            case INVALID_JOB -> {
                log.warn("OCR job {} of record {} is unknown to the service.", record.getExternalJobRef(),
                         record.getId());
                yield write(record, RecordPatch.fail(ErrorInfo.of(ErrorKind.INVALID_JOB_REFERENCE), true),
                            RecordOutcome.FAILED);
            }
            case NOT_FOUND -> {
                if (elapsed.compareTo(extractionProperties.getNotFoundGracePeriod()) > 0) {
                    log.warn("OCR job {} of record {} is still not visible {} after submission.",
                             record.getExternalJobRef(), record.getId(), elapsed);
                }
                yield write(record, RecordPatch.touch(), RecordOutcome.STILL_PROCESSING);
            }
            case IN_PROGRESS -> write(record, RecordPatch.touch(), RecordOutcome.STILL_PROCESSING);
        };
    }

    private RecordOutcome completeFromResult(final DocumentRecord record) {
        final String text;
        try {
            text = asyncJobService.fetchResult(record.getExternalJobRef());
        } catch (final RuntimeException e) {
            return handlePollError(record, e);
        }
        if (text == null || text.isBlank()) {
            log.info("OCR job {} of record {} succeeded without text.", record.getExternalJobRef(), record.getId());
            return write(record, RecordPatch.fail(ErrorInfo.of(ErrorKind.EMPTY_RESULT), true), RecordOutcome.FAILED);
        }
        return write(record, RecordPatch.complete(text, true), RecordOutcome.COMPLETED);
    }

    /**
     * A poll that fails is retried on the next pass until the failed polls of the current cycle exceed
     * the ceiling. Successful polls do not count toward it.
     */
    private RecordOutcome handlePollError(final DocumentRecord record, final RuntimeException error) {
        final int failures = record.getPollFailureCount() + 1;
        if (failures > extractionProperties.getMaxPollAttempts()) {
            log.error("Giving up on OCR job {} of record {} after {} failed polls.", record.getExternalJobRef(),
                      record.getId(), failures, error);
            final ErrorInfo errorInfo = new ErrorInfo(ErrorKind.EXTERNAL_SERVICE_ERROR,
                                                      "The text extraction service could not be reached.", true);
            return write(record, RecordPatch.fail(errorInfo, true), RecordOutcome.FAILED);
        }
        log.warn("Polling OCR job {} of record {} failed ({} of {}): {}", record.getExternalJobRef(),
                 record.getId(), failures, extractionProperties.getMaxPollAttempts(), error.getMessage());
        return write(record, RecordPatch.pollFailure(), RecordOutcome.POLL_ERROR);
    }

    private RecordOutcome write(final DocumentRecord observed, final RecordPatch patch,
                                final RecordOutcome onSuccess) {
        return documentRecordStore.compareAndUpdate(observed, patch, clock.instant())
                                  .map(updated -> onSuccess)
                                  .orElse(RecordOutcome.CONFLICT);
    }

    private ErrorInfo timeoutError() {
        return new ErrorInfo(ErrorKind.TIMEOUT,
                             String.format("Text extraction did not finish within %d minutes.",
                                           extractionProperties.getTimeoutThreshold().toMinutes()),
                             ErrorKind.TIMEOUT.isRetryable());
    }
}
