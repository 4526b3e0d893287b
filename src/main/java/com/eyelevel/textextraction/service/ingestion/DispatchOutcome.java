package com.eyelevel.textextraction.service.ingestion;

import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.RecordPatch;

/**
 * Result of handing an artifact to its extraction backend.
 */
public record DispatchOutcome(Type type, String extractedText, ErrorInfo errorInfo, String externalJobRef) {

    public enum Type {
        COMPLETED,
        FAILED,
        SUBMITTED
    }

    public static DispatchOutcome completed(String extractedText) {
        return new DispatchOutcome(Type.COMPLETED, extractedText, null, null);
    }

    public static DispatchOutcome failed(ErrorInfo errorInfo) {
        return new DispatchOutcome(Type.FAILED, null, errorInfo, null);
    }

    public static DispatchOutcome submitted(String externalJobRef) {
        return new DispatchOutcome(Type.SUBMITTED, null, null, externalJobRef);
    }

    /**
     * The transition that applies this outcome to a record waiting in PENDING after a retry.
     */
    public RecordPatch toPatch() {
        return switch (type) {
            case COMPLETED -> RecordPatch.complete(extractedText, false);
            case FAILED -> RecordPatch.fail(errorInfo, false);
            case SUBMITTED -> RecordPatch.attachJob(externalJobRef);
        };
    }
}
