package com.eyelevel.textextraction.service.retry;

import com.eyelevel.textextraction.exception.DocumentNotFoundException;
import com.eyelevel.textextraction.exception.RetryFailedException;
import com.eyelevel.textextraction.model.DocumentFormat;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.service.ingestion.DispatchOutcome;
import com.eyelevel.textextraction.service.ingestion.ExtractionDispatcher;
import com.eyelevel.textextraction.support.DocumentRecords;
import com.eyelevel.textextraction.support.InMemoryDocumentRecordStore;
import com.eyelevel.textextraction.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-02T10:00:00Z");

    @Mock
    private ExtractionDispatcher extractionDispatcher;

    private InMemoryDocumentRecordStore store;
    private MutableClock clock;
    private RetryService retryService;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentRecordStore();
        clock = new MutableClock(T0.plus(Duration.ofHours(2)));
        retryService = new RetryService(store, extractionDispatcher, clock);
    }

    @Test
    void retryableFailureIsResubmittedInANewCycle() {
        // Given
        store.create(DocumentRecords.failedAsync("doc-1", ErrorInfo.of(ErrorKind.EXTERNAL_SERVICE_ERROR), T0));
        when(extractionDispatcher.dispatch("doc-1", "doc-1.pdf", DocumentFormat.PDF, "documents/doc-1/file", null))
                .thenReturn(DispatchOutcome.submitted("job-new"));

        // When
        DocumentRecord record = retryService.retry("doc-1");

        // Then
        assertThat(record.getStatus()).isEqualTo(DocumentStatus.PROCESSING);
        assertThat(record.getExternalJobRef()).isEqualTo("job-new");
        assertThat(record.getErrorInfo()).isNull();
        assertThat(record.getCycleStartedAt()).isEqualTo(clock.instant());
        assertThat(record.getAttemptCount()).isEqualTo(4);
        assertThat(store.read("doc-1")).contains(record);
    }

    @Test
    void timedOutRecordCanBeRetried() {
        // Given
        DocumentRecord timedOut = DocumentRecords.failedAsync("doc-2", ErrorInfo.of(ErrorKind.TIMEOUT), T0)
                                                 .toBuilder().status(DocumentStatus.TIMED_OUT).build();
        store.create(timedOut);
        when(extractionDispatcher.dispatch("doc-2", "doc-2.pdf", DocumentFormat.PDF, "documents/doc-2/file", null))
                .thenReturn(DispatchOutcome.failed(ErrorInfo.of(ErrorKind.DOCUMENT_CORRUPTED)));

        // When
        DocumentRecord record = retryService.retry("doc-2");

        // Then - the new outcome replaces the old one
        assertThat(record.getStatus()).isEqualTo(DocumentStatus.FAILED);
        assertThat(record.getErrorKind()).isEqualTo(ErrorKind.DOCUMENT_CORRUPTED);
    }

    @Test
    void nonRetryableErrorIsRejected() {
        // Given
        store.create(DocumentRecords.failedAsync("doc-3", ErrorInfo.of(ErrorKind.INVALID_JOB_REFERENCE), T0));

        // When / Then
        assertThatThrownBy(() -> retryService.retry("doc-3"))
                .isInstanceOf(RetryFailedException.class)
                .hasMessageContaining("not retryable");
        assertThat(store.read("doc-3").orElseThrow().getStatus()).isEqualTo(DocumentStatus.FAILED);
        verifyNoInteractions(extractionDispatcher);
    }

    @Test
    void completedRecordIsRejected() {
        // Given
        store.create(DocumentRecords.completedSync("doc-4", "text", T0));

        // When / Then
        assertThatThrownBy(() -> retryService.retry("doc-4"))
                .isInstanceOf(RetryFailedException.class)
                .hasMessageContaining("COMPLETED");
    }

    @Test
    void recordWithoutStoredArtifactIsRejected() {
        // Given
        store.create(DocumentRecords.failedAsync("doc-5", ErrorInfo.of(ErrorKind.TIMEOUT), T0)
                                    .toBuilder().storageKey(null).build());

        // When / Then
        assertThatThrownBy(() -> retryService.retry("doc-5")).isInstanceOf(RetryFailedException.class);
    }

    @Test
    void unknownDocumentIsNotFound() {
        assertThatThrownBy(() -> retryService.retry("missing")).isInstanceOf(DocumentNotFoundException.class);
    }

    @Test
    void concurrentRetryLosesTheRace() {
        // Given - the same snapshot was already retried by someone else
        DocumentRecord failed = store.create(
                DocumentRecords.failedAsync("doc-6", ErrorInfo.of(ErrorKind.EXTERNAL_SERVICE_ERROR), T0));
        InMemoryDocumentRecordStore racing = new InMemoryDocumentRecordStore() {
            @Override
            public Optional<DocumentRecord> read(String id) {
                Optional<DocumentRecord> snapshot = store.read(id);
                store.compareAndUpdate(failed, RecordPatch.retry(), clock.instant());
                return snapshot;
            }

            @Override
            public Optional<DocumentRecord> compareAndUpdate(DocumentRecord observed, RecordPatch patch,
                                                                       Instant now) {
                return store.compareAndUpdate(observed, patch, now);
            }
        };
        RetryService service = new RetryService(racing, extractionDispatcher, clock);

        // When / Then
        assertThatThrownBy(() -> service.retry("doc-6"))
                .isInstanceOf(RetryFailedException.class)
                .hasMessageContaining("modified concurrently");
        verifyNoInteractions(extractionDispatcher);
    }

    @Test
    void dispatchRaceReturnsTheRecordAsStored() {
        // Given - a reconciliation pass times the PENDING record out while it is dispatched
        store.create(DocumentRecords.failedAsync("doc-7", ErrorInfo.of(ErrorKind.EXTERNAL_SERVICE_ERROR), T0));
        when(extractionDispatcher.dispatch("doc-7", "doc-7.pdf", DocumentFormat.PDF, "documents/doc-7/file", null))
                .thenAnswer(invocation -> {
                    DocumentRecord pending = store.read("doc-7").orElseThrow();
                    store.compareAndUpdate(pending, RecordPatch.timeOut(ErrorInfo.of(ErrorKind.TIMEOUT)),
                                           clock.instant());
                    return DispatchOutcome.submitted("job-late");
                });

        // When
        DocumentRecord record = retryService.retry("doc-7");

        // Then
        assertThat(record.getStatus()).isEqualTo(DocumentStatus.TIMED_OUT);
        assertThat(record.getExternalJobRef()).isNull();
        assertThat(store.conflicts()).isEqualTo(1);
    }
}
