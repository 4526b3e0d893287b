package com.eyelevel.textextraction.client.monitor.progress;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Estimated phase of a document's extraction, inferred from elapsed time since the backend does not
 * report its own progress.
 */
@Getter
@AllArgsConstructor
public enum ProcessingStage {
    QUEUED("Waiting to start processing..."),
    PREPARING("Preparing document..."),
    EXTRACTING("Extracting text..."),
    FINALIZING("Finalizing results..."),
    DONE("Text extraction complete.");

    /**
     * Stages a running document moves through, in order.
     */
    public static final List<ProcessingStage> RUNNING_STAGES = List.of(QUEUED, PREPARING, EXTRACTING, FINALIZING);

    private final String message;
}
