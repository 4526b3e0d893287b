package com.eyelevel.textextraction.common.apiclient.ocr;

import com.eyelevel.textextraction.common.apiclient.ApiClient;
import com.eyelevel.textextraction.common.apiclient.authentication.Authentication;
import com.eyelevel.textextraction.common.apiclient.model.ApiRequest;
import com.eyelevel.textextraction.common.apiclient.model.ApiResponse;
import com.eyelevel.textextraction.common.apiclient.model.HeaderConfig;
import com.eyelevel.textextraction.common.json.JsonParser;
import com.eyelevel.textextraction.dto.ocr.OcrJobResultResponse;
import com.eyelevel.textextraction.dto.ocr.OcrJobStatusResponse;
import com.eyelevel.textextraction.dto.ocr.OcrSubmitRequest;
import com.eyelevel.textextraction.dto.ocr.OcrSubmitResponse;
import com.eyelevel.textextraction.exception.apiclient.ApiException;
import com.eyelevel.textextraction.exception.apiclient.BadRequestException;
import com.eyelevel.textextraction.exception.apiclient.GatewayTimeoutException;
import com.eyelevel.textextraction.exception.apiclient.GoneException;
import com.eyelevel.textextraction.exception.apiclient.NotFoundException;
import com.eyelevel.textextraction.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.textextraction.exception.apiclient.TooManyRequestsException;
import com.eyelevel.textextraction.exception.json.JsonParsingException;
import com.eyelevel.textextraction.service.job.AsyncJobService;
import com.eyelevel.textextraction.service.job.ExternalJobStatus;
import com.eyelevel.textextraction.service.job.JobPollResult;
import com.eyelevel.textextraction.service.job.JobSubmission;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Client for the external OCR job API.
 */
@Slf4j
@Service("ocrJobApiClient")
public class OcrJobApiClient extends ApiClient implements AsyncJobService {

    private final JsonParser jsonParser;
    private final String submitJobEndpoint;
    private final String jobStatusEndpoint;
    private final String jobResultEndpoint;

    /**
     * @param webClient         WebClient pointed at the OCR service base URL.
     * @param authentication    API key authentication for the OCR service.
     * @param headerConfig      Static headers sent with every call.
     * @param jsonParser        Parser for response bodies.
     * @param submitJobEndpoint Path of the submit endpoint.
     * @param jobStatusEndpoint Path of the status endpoint, with a {@code {jobRef}} placeholder.
     * @param jobResultEndpoint Path of the result endpoint, with a {@code {jobRef}} placeholder.
     */
    public OcrJobApiClient(
            @Qualifier("ocrWebClient") final WebClient webClient,
            @Qualifier("ocrAuthentication") final Authentication authentication,
            @Qualifier("ocrHeader") final HeaderConfig headerConfig,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.ocr-client.endpoint.submit-job}") final String submitJobEndpoint,
            @Value("${app.ocr-client.endpoint.job-status}") final String jobStatusEndpoint,
            @Value("${app.ocr-client.endpoint.job-result}") final String jobResultEndpoint
    ) {
        super(webClient, authentication, headerConfig);
        this.jsonParser = jsonParser;
        this.submitJobEndpoint = submitJobEndpoint;
        this.jobStatusEndpoint = jobStatusEndpoint;
        this.jobResultEndpoint = jobResultEndpoint;
    }

    /**
     * Submits a document for OCR. Rate limiting, unavailability and gateway timeouts are retried a
     * bounded number of times before the error is propagated.
     *
     * @throws ApiException if the service rejects the job or stays unavailable.
     */
    @Override
    @Retryable(
            retryFor = {ServiceUnavailableException.class, GatewayTimeoutException.class,
                    TooManyRequestsException.class},
            maxAttemptsExpression = "#{${app.extraction.submission-retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.extraction.submission-retry.delay-ms}}"),
            listeners = {"jobSubmissionRetryListener"})
    public String submit(final JobSubmission submission) {
        log.info("Submitting document {} ({}) to the OCR service.", submission.documentId(),
                 submission.format().getCode());
        final OcrSubmitRequest body = new OcrSubmitRequest(submission.documentId(), submission.fileName(),
                                                           submission.format().getCode(), submission.sourceUrl());
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(submitJobEndpoint)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();

        final OcrSubmitResponse response = parse(call(apiRequest), OcrSubmitResponse.class);
        if (response.jobId() == null || response.jobId().isBlank()) {
            throw new ApiException("OCR service accepted the job but returned no job id.",
                                   HttpStatus.BAD_GATEWAY.value());
        }
        log.info("Document {} submitted as OCR job {}.", submission.documentId(), response.jobId());
        return response.jobId();
    }

    @Override
    public JobPollResult poll(final String jobRef) {
        try {
            final OcrJobStatusResponse response = parse(call(jobRequest(jobStatusEndpoint, jobRef)),
                                                        OcrJobStatusResponse.class);
            final ExternalJobStatus status = ExternalJobStatus.convertByValue(response.status());
            log.debug("OCR job {} reported status '{}' ({}).", jobRef, response.status(), status);
            if (response.error() != null) {
                return new JobPollResult(status, response.error().code(), response.error().message());
            }
            return JobPollResult.of(status);
        } catch (final NotFoundException e) {
            return JobPollResult.of(ExternalJobStatus.NOT_FOUND);
        } catch (final BadRequestException | GoneException e) {
            log.warn("OCR service rejected job reference {} with status {}.", jobRef, e.getStatusCode());
            return JobPollResult.invalid(e.getMessage());
        }
    }

    @Override
    public String fetchResult(final String jobRef) {
        final OcrJobResultResponse response = parse(call(jobRequest(jobResultEndpoint, jobRef)),
                                                    OcrJobResultResponse.class);
        return response.text() == null ? "" : response.text();
    }

    private ApiRequest jobRequest(final String endpoint, final String jobRef) {
        return ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(endpoint)
                .pathVariables(Map.of("jobRef", jobRef))
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }

    private <T> T parse(final ApiResponse apiResponse, final Class<T> type) {
        try {
            return jsonParser.parseObject(apiResponse.getData(), type);
        } catch (final JsonParsingException e) {
            throw new ApiException("Unreadable response from OCR service: " + e.getMessage(),
                                   HttpStatus.BAD_GATEWAY.value());
        }
    }
}
