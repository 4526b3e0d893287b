package com.eyelevel.textextraction.service.job;

import java.util.Objects;

/**
 * Outcome of one poll of an external job.
 *
 * @param status       the job state
 * @param errorCode    structured error code for {@link ExternalJobStatus#FAILED}, may be null
 * @param errorMessage free-text error from the service, may be null
 */
public record JobPollResult(ExternalJobStatus status, String errorCode, String errorMessage) {

    public JobPollResult {
        Objects.requireNonNull(status, "status must not be null");
    }

    public static JobPollResult of(ExternalJobStatus status) {
        return new JobPollResult(status, null, null);
    }

    public static JobPollResult failed(String errorCode, String errorMessage) {
        return new JobPollResult(ExternalJobStatus.FAILED, errorCode, errorMessage);
    }

    public static JobPollResult invalid(String errorMessage) {
        return new JobPollResult(ExternalJobStatus.INVALID_JOB, null, errorMessage);
    }
}
