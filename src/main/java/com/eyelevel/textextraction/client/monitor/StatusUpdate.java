package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.client.error.UserFacingError;
import com.eyelevel.textextraction.client.monitor.progress.ProcessingStage;
import com.eyelevel.textextraction.model.DocumentStatus;

import java.time.Duration;

/**
 * One observation of a monitoring session.
 *
 * @param status           last status read from the backend
 * @param nextPollInterval delay before the next poll, null once the session is finished
 * @param transientError   set when this poll failed and the session keeps polling
 */
public record StatusUpdate(String documentId, DocumentStatus status, ProcessingStage stage, int progressPercent,
                           Duration elapsed, Duration nextPollInterval, UserFacingError transientError) {
}
