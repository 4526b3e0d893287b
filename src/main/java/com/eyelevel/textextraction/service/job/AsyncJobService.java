package com.eyelevel.textextraction.service.job;

/**
 * External asynchronous extraction service. Polling must be free of side effects so that it can be
 * repeated by overlapping reconciliation passes.
 */
public interface AsyncJobService {

    /**
     * Submits an artifact for extraction.
     *
     * @return the opaque job reference used for later polls
     * @throws com.eyelevel.textextraction.exception.apiclient.ApiException if the service rejects or
     *                                                                      cannot accept the job
     */
    String submit(JobSubmission submission);

    /**
     * Reads the current state of a job. Unknown or expired references are reported through
     * {@link ExternalJobStatus#NOT_FOUND} and {@link ExternalJobStatus#INVALID_JOB} rather than thrown.
     *
     * @throws com.eyelevel.textextraction.exception.apiclient.ApiException on transport or service errors
     */
    JobPollResult poll(String jobRef);

    /**
     * Fetches the text of a job that reported {@link ExternalJobStatus#SUCCEEDED}.
     *
     * @return the extracted text, possibly empty
     */
    String fetchResult(String jobRef);
}
