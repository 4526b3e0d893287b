package com.eyelevel.textextraction.model;

import com.eyelevel.textextraction.exception.InvalidRecordStateException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.util.Objects;

/**
 * A single lifecycle transition to apply to a record through a conditional update.
 *
 * <p>Patches are built with the static factories and turned into the next record state with
 * {@link #applyTo(DocumentRecord, Instant)}, which rejects anything the lifecycle does not allow.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RecordPatch {

    public enum Type {
        /** Stay in the current active status and count the attempt. */
        TOUCH,
        /** Like {@link #TOUCH}, and also count a failed poll of the job. */
        POLL_FAILURE,
        /** Attach a freshly submitted job and move to PROCESSING. */
        ATTACH_JOB,
        COMPLETE,
        FAIL,
        TIME_OUT,
        /** Open a new attempt cycle from a terminal status. */
        RETRY
    }

    private final Type type;
    private final String externalJobRef;
    private final String extractedText;
    private final ErrorInfo errorInfo;
    private final boolean countsAttempt;

    public static RecordPatch touch() {
        return new RecordPatch(Type.TOUCH, null, null, null, true);
    }

    public static RecordPatch pollFailure() {
        return new RecordPatch(Type.POLL_FAILURE, null, null, null, true);
    }

    public static RecordPatch attachJob(String externalJobRef) {
        Objects.requireNonNull(externalJobRef, "externalJobRef must not be null");
        return new RecordPatch(Type.ATTACH_JOB, externalJobRef, null, null, false);
    }

    /**
     * Stores the extracted text and moves the record to COMPLETED.
     *
     * @param countsAttempt true when written by a reconciliation pass, false for the dispatch that
     *                      follows a retry
     */
    public static RecordPatch complete(String extractedText, boolean countsAttempt) {
        Objects.requireNonNull(extractedText, "extractedText must not be null");
        return new RecordPatch(Type.COMPLETE, null, extractedText, null, countsAttempt);
    }

    public static RecordPatch fail(ErrorInfo errorInfo, boolean countsAttempt) {
        Objects.requireNonNull(errorInfo, "errorInfo must not be null");
        return new RecordPatch(Type.FAIL, null, null, errorInfo, countsAttempt);
    }

    public static RecordPatch timeOut(ErrorInfo errorInfo) {
        Objects.requireNonNull(errorInfo, "errorInfo must not be null");
        return new RecordPatch(Type.TIME_OUT, null, null, errorInfo, true);
    }

    public static RecordPatch retry() {
        return new RecordPatch(Type.RETRY, null, null, null, true);
    }

    /**
     * Computes the state the record has after this patch.
     *
     * @param current the state last read by the writer
     * @param now     time of the write
     * @return a new record instance; {@code current} is left untouched
     * @throws InvalidRecordStateException if the transition is not allowed from the current status
     */
    public DocumentRecord applyTo(DocumentRecord current, Instant now) {
        DocumentStatus from = current.getStatus();
        DocumentStatus to = targetStatus(from);

        if (type == Type.RETRY) {
            if (!from.isTerminal()) {
                throw new InvalidRecordStateException(
                        "Record " + current.getId() + " can only be retried from a terminal status, was " + from);
            }
        } else if (!from.canAdvanceTo(to)) {
            throw new InvalidRecordStateException(
                    "Record " + current.getId() + " cannot move from " + from + " to " + to);
        }
        if (type == Type.ATTACH_JOB && current.getExternalJobRef() != null) {
            throw new InvalidRecordStateException(
                    "Record " + current.getId() + " already has a job reference attached.");
        }

        DocumentRecord.DocumentRecordBuilder next = current.toBuilder()
                .status(to)
                .updatedAt(now)
                .attemptCount(countsAttempt ? current.getAttemptCount() + 1 : current.getAttemptCount());

        switch (type) {
            case ATTACH_JOB -> next.externalJobRef(externalJobRef);
            case COMPLETE -> next.extractedText(extractedText);
            case FAIL, TIME_OUT -> next.errorKind(errorInfo.kind())
                                       .errorMessage(errorInfo.message())
                                       .errorRetryable(errorInfo.retryable());
            case RETRY -> next.externalJobRef(null)
                              .extractedText(null)
                              .errorKind(null)
                              .errorMessage(null)
                              .errorRetryable(null)
                              .pollFailureCount(0)
                              .cycleStartedAt(now);
            case POLL_FAILURE -> next.pollFailureCount(current.getPollFailureCount() + 1);
            case TOUCH -> {
                // status and fields unchanged apart from the counters
            }
        }

        DocumentRecord result = next.build();
        result.verifyInvariants();
        return result;
    }

    private DocumentStatus targetStatus(DocumentStatus from) {
        return switch (type) {
            case TOUCH, POLL_FAILURE -> from;
            case ATTACH_JOB -> DocumentStatus.PROCESSING;
            case COMPLETE -> DocumentStatus.COMPLETED;
            case FAIL -> DocumentStatus.FAILED;
            case TIME_OUT -> DocumentStatus.TIMED_OUT;
            case RETRY -> DocumentStatus.PENDING;
        };
    }
}
