package com.eyelevel.textextraction.service.reconciliation;

import com.eyelevel.textextraction.config.ExtractionProperties;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.service.job.AsyncJobService;
import com.eyelevel.textextraction.service.job.ExternalJobStatus;
import com.eyelevel.textextraction.service.job.JobPollResult;
import com.eyelevel.textextraction.support.DocumentRecords;
import com.eyelevel.textextraction.support.InMemoryDocumentRecordStore;
import com.eyelevel.textextraction.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Two passes that read the same record before either writes.
 */
class ConcurrentReconciliationTest {

    private static final Instant T0 = Instant.parse("2024-05-02T10:00:00Z");

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void overlappingPassesWriteCompletionExactlyOnce() throws Exception {
        // Given - both passes hold their snapshot until the other has polled too
        InMemoryDocumentRecordStore store = new InMemoryDocumentRecordStore();
        MutableClock clock = new MutableClock(T0.plusSeconds(90));
        store.create(DocumentRecords.processing("doc-1", "J1", T0));

        CyclicBarrier bothPolled = new CyclicBarrier(2);
        AsyncJobService jobService = mock(AsyncJobService.class);
        when(jobService.poll("J1")).thenAnswer(invocation -> {
            bothPolled.await(5, TimeUnit.SECONDS);
            return JobPollResult.of(ExternalJobStatus.SUCCEEDED);
        });
        when(jobService.fetchResult("J1")).thenReturn("hello");

        DocumentReconciler first = new DocumentReconciler(store, jobService, new JobErrorTranslator(),
                                                          new ExtractionProperties(), clock);
        DocumentReconciler second = new DocumentReconciler(store, jobService, new JobErrorTranslator(),
                                                           new ExtractionProperties(), clock);

        // When
        List<Future<ReconciliationSummary>> passes = executor.invokeAll(
                List.of(first::reconcile, second::reconcile), 10, TimeUnit.SECONDS);
        ReconciliationSummary a = passes.get(0).get();
        ReconciliationSummary b = passes.get(1).get();

        // Then
        assertThat(a.completed() + b.completed()).isEqualTo(1);
        assertThat(a.conflicts() + b.conflicts()).isEqualTo(1);
        assertThat(store.successfulUpdates()).isEqualTo(1);

        DocumentRecord record = store.read("doc-1").orElseThrow();
        assertThat(record.getStatus()).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(record.getExtractedText()).isEqualTo("hello");
        assertThat(record.getAttemptCount()).isEqualTo(1);
    }

    @Test
    void passAfterCompletionLeavesTerminalRecordUntouched() {
        // Given
        InMemoryDocumentRecordStore store = new InMemoryDocumentRecordStore();
        MutableClock clock = new MutableClock(T0.plusSeconds(60));
        store.create(DocumentRecords.processing("doc-2", "J2", T0));
        AsyncJobService jobService = mock(AsyncJobService.class);
        when(jobService.poll("J2")).thenReturn(JobPollResult.of(ExternalJobStatus.SUCCEEDED));
        when(jobService.fetchResult("J2")).thenReturn("done");
        DocumentReconciler reconciler = new DocumentReconciler(store, jobService, new JobErrorTranslator(),
                                                               new ExtractionProperties(), clock);
        reconciler.reconcile();
        DocumentRecord completed = store.read("doc-2").orElseThrow();

        // When
        clock.advance(Duration.ofHours(3));
        ReconciliationSummary summary = reconciler.reconcile();

        // Then
        assertThat(summary.scanned()).isZero();
        assertThat(store.read("doc-2")).contains(completed);
    }
}
