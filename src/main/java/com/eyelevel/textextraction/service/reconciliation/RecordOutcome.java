package com.eyelevel.textextraction.service.reconciliation;

/**
 * What a reconciliation pass did with one record.
 */
public enum RecordOutcome {
    COMPLETED,
    FAILED,
    TIMED_OUT,
    /** The job is still running or not visible yet; the attempt was counted. */
    STILL_PROCESSING,
    /** Polling failed and will be retried on the next pass. */
    POLL_ERROR,
    /** Nothing to poll yet, e.g. a retried record whose dispatch has not attached a job. */
    SKIPPED,
    /** Another writer changed the record first; this pass left it alone. */
    CONFLICT,
    /** Unexpected failure while handling the record. */
    ERROR
}
