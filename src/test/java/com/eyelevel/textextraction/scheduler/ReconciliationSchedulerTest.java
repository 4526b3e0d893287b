package com.eyelevel.textextraction.scheduler;

import com.eyelevel.textextraction.service.reconciliation.DocumentReconciler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private DocumentReconciler documentReconciler;

    @InjectMocks
    private ReconciliationScheduler scheduler;

    @Test
    void eachTickRunsOnePass() {
        scheduler.reconcileActiveDocuments();

        verify(documentReconciler).reconcile();
    }

    @Test
    void failedPassDoesNotStopTheSchedule() {
        when(documentReconciler.reconcile()).thenThrow(new IllegalStateException("database unavailable"));

        assertThatCode(() -> scheduler.reconcileActiveDocuments()).doesNotThrowAnyException();
    }
}
