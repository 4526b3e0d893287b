package com.eyelevel.textextraction.scheduler;

import com.eyelevel.textextraction.service.reconciliation.DocumentReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Triggers a reconciliation pass on a fixed cadence. Passes started by other instances may overlap
 * with this one; {@link DocumentReconciler} is safe under that.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationScheduler {

    private final DocumentReconciler documentReconciler;

    @Scheduled(fixedDelayString = "${app.extraction.reconciliation-interval}",
               initialDelayString = "${app.extraction.reconciliation-interval}")
    public void reconcileActiveDocuments() {
        log.info("Starting document reconciliation scheduler...");
        try {
            documentReconciler.reconcile();
        } catch (final Exception e) {
            log.error("Reconciliation pass aborted before completion.", e);
        }
    }
}
