package com.eyelevel.textextraction.service.reconciliation;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of one reconciliation pass.
 */
public record ReconciliationSummary(int scanned, int completed, int failed, int timedOut, int stillProcessing,
                                    int pollErrors, int skipped, int conflicts, int errors, Duration duration) {

    static ReconciliationSummary of(int scanned, Map<RecordOutcome, Integer> outcomes, Duration duration) {
        Map<RecordOutcome, Integer> counts = outcomes.isEmpty() ? new EnumMap<>(RecordOutcome.class)
                                                                : new EnumMap<>(outcomes);
        return new ReconciliationSummary(
                scanned,
                counts.getOrDefault(RecordOutcome.COMPLETED, 0),
                counts.getOrDefault(RecordOutcome.FAILED, 0),
                counts.getOrDefault(RecordOutcome.TIMED_OUT, 0),
                counts.getOrDefault(RecordOutcome.STILL_PROCESSING, 0),
                counts.getOrDefault(RecordOutcome.POLL_ERROR, 0),
                counts.getOrDefault(RecordOutcome.SKIPPED, 0),
                counts.getOrDefault(RecordOutcome.CONFLICT, 0),
                counts.getOrDefault(RecordOutcome.ERROR, 0),
                duration);
    }
}
