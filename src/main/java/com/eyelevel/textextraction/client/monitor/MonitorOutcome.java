package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.client.error.UserFacingError;

import java.time.Duration;

/**
 * How a monitoring session ended.
 *
 * @param extractedText set for {@link Type#COMPLETED}
 * @param error         set for {@link Type#FAILED} and {@link Type#CLIENT_TIMEOUT}
 */
public record MonitorOutcome(Type type, String documentId, String extractedText, UserFacingError error,
                             Duration elapsed) {

    public enum Type {
        COMPLETED,
        FAILED,
        /** The session ran longer than its maximum duration. The backend may still finish the document. */
        CLIENT_TIMEOUT,
        CANCELLED
    }

    static MonitorOutcome completed(String documentId, String extractedText, Duration elapsed) {
        return new MonitorOutcome(Type.COMPLETED, documentId, extractedText, null, elapsed);
    }

    static MonitorOutcome failed(String documentId, UserFacingError error, Duration elapsed) {
        return new MonitorOutcome(Type.FAILED, documentId, null, error, elapsed);
    }

    static MonitorOutcome clientTimeout(String documentId, UserFacingError error, Duration elapsed) {
        return new MonitorOutcome(Type.CLIENT_TIMEOUT, documentId, null, error, elapsed);
    }

    static MonitorOutcome cancelled(String documentId, Duration elapsed) {
        return new MonitorOutcome(Type.CANCELLED, documentId, null, null, elapsed);
    }
}
