package com.eyelevel.textextraction.service.record;

import com.eyelevel.textextraction.exception.InvalidRecordStateException;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.model.SourceKind;
import com.eyelevel.textextraction.repository.DocumentRecordRepository;
import com.eyelevel.textextraction.support.DocumentRecords;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs against H2. Transactions are disabled so that every store call commits on its own, as in
 * production.
 */
@DataJpaTest
@Import(JpaDocumentRecordStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaDocumentRecordStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-02T10:00:00Z");

    @Autowired
    private JpaDocumentRecordStore store;

    @Autowired
    private DocumentRecordRepository repository;

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    void createdRecordCanBeReadBack() {
        // Given
        DocumentRecord record = DocumentRecords.processing("doc-1", "J1", T0);

        // When
        store.create(record);
        Optional<DocumentRecord> read = store.read("doc-1");

        // Then
        assertThat(read).isPresent();
        assertThat(read.get()).usingRecursiveComparison().isEqualTo(record);
    }

    @Test
    void readOfUnknownIdIsEmpty() {
        assertThat(store.read("missing")).isEmpty();
    }

    @Test
    void compareAndUpdateAppliesPatchWhenStateIsUnchanged() {
        // Given
        DocumentRecord observed = store.create(DocumentRecords.processing("doc-2", "J2", T0));
        Instant now = T0.plus(2, ChronoUnit.MINUTES);

        // When
        Optional<DocumentRecord> updated = store.compareAndUpdate(observed, RecordPatch.complete("hello", true), now);

        // Then
        assertThat(updated).isPresent();
        DocumentRecord stored = store.read("doc-2").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(stored.getExtractedText()).isEqualTo("hello");
        assertThat(stored.getAttemptCount()).isEqualTo(1);
        assertThat(stored.getUpdatedAt()).isEqualTo(now);
        assertThat(stored.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    void compareAndUpdateWithStaleSnapshotWritesNothing() {
        // Given - a second writer advanced the attempt count first
        DocumentRecord observed = store.create(DocumentRecords.processing("doc-3", "J3", T0));
        store.compareAndUpdate(observed, RecordPatch.touch(), T0.plusSeconds(60));

        // When
        Optional<DocumentRecord> result = store.compareAndUpdate(
                observed, RecordPatch.fail(ErrorInfo.of(ErrorKind.DOCUMENT_CORRUPTED), true), T0.plusSeconds(61));

        // Then
        assertThat(result).isEmpty();
        DocumentRecord stored = store.read("doc-3").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(DocumentStatus.PROCESSING);
        assertThat(stored.getAttemptCount()).isEqualTo(1);
        assertThat(stored.getErrorKind()).isNull();
    }

    @Test
    void failedPollIsCountedInTheStoredRecord() {
        // Given
        DocumentRecord observed = store.create(DocumentRecords.processing("doc-9", "J9", T0));

        // When
        store.compareAndUpdate(observed, RecordPatch.pollFailure(), T0.plusSeconds(60));

        // Then
        DocumentRecord stored = store.read("doc-9").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(DocumentStatus.PROCESSING);
        assertThat(stored.getAttemptCount()).isEqualTo(1);
        assertThat(stored.getPollFailureCount()).isEqualTo(1);
    }

    @Test
    void retryOpensNewCycleAndClearsOutcome() {
        // Given
        DocumentRecord failed = store.create(
                DocumentRecords.failedAsync("doc-4", ErrorInfo.of(ErrorKind.TIMEOUT), T0).toBuilder()
                               .pollFailureCount(7)
                               .build());
        Instant retriedAt = T0.plus(3, ChronoUnit.HOURS);

        // When
        store.compareAndUpdate(failed, RecordPatch.retry(), retriedAt);

        // Then
        DocumentRecord stored = store.read("doc-4").orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(DocumentStatus.PENDING);
        assertThat(stored.getErrorInfo()).isNull();
        assertThat(stored.getExternalJobRef()).isNull();
        assertThat(stored.getCycleStartedAt()).isEqualTo(retriedAt);
        assertThat(stored.getPollFailureCount()).isZero();
        assertThat(stored.getStorageKey()).isEqualTo("documents/doc-4/file");
    }

    @Test
    void duplicateIdIsRejected() {
        // Given
        store.create(DocumentRecords.pendingAsync("doc-5", T0));

        // When / Then
        assertThatThrownBy(() -> store.create(DocumentRecords.pendingAsync("doc-5", T0)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("doc-5");
    }

    @Test
    void recordBreakingInvariantsIsNeverStored() {
        // Given - completed without text
        DocumentRecord broken = DocumentRecords.completedSync("doc-6", "x", T0).toBuilder().extractedText(null).build();

        // When / Then
        assertThatThrownBy(() -> store.create(broken)).isInstanceOf(InvalidRecordStateException.class);
        assertThat(repository.existsById("doc-6")).isFalse();
    }

    @Test
    void queryReturnsOnlyMatchingRecordsOldestFirst() {
        // Given
        store.create(DocumentRecords.processing("newer", "J7", T0.plusSeconds(30)));
        store.create(DocumentRecords.pendingAsync("older", T0));
        store.create(DocumentRecords.completedSync("sync", "text", T0.minusSeconds(30)));
        store.create(DocumentRecords.failedAsync("failed", ErrorInfo.of(ErrorKind.EMPTY_RESULT), T0));

        // When
        List<DocumentRecord> active = store.queryByStatus(DocumentStatus.ACTIVE_STATUSES,
                                                          SourceKind.ASYNCHRONOUS_JOB);

        // Then
        assertThat(active).extracting(DocumentRecord::getId).containsExactly("older", "newer");
    }
}
