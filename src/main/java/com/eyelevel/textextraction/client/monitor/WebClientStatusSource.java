package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.dto.common.ApiResponse;
import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Reads document status from the REST API of this service.
 */
@Slf4j
public class WebClientStatusSource implements StatusSource {

    private static final String STATUS_PATH = "/documents/{documentId}/status";
    private static final ParameterizedTypeReference<ApiResponse<DocumentStatusResponse>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final Duration requestTimeout;

    public WebClientStatusSource(final WebClient webClient, final Duration requestTimeout) {
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public Mono<DocumentStatusResponse> fetchStatus(final String documentId) {
        return webClient.get()
                        .uri(STATUS_PATH, documentId)
                        .accept(MediaType.APPLICATION_JSON)
                        .retrieve()
                        .bodyToMono(RESPONSE_TYPE)
                        .flatMap(body -> Mono.justOrEmpty(body.getResponse()))
                        .switchIfEmpty(Mono.error(() -> new StatusFetchException(
                                "Status response for document " + documentId + " had no body.", null, true, null)))
                        .timeout(requestTimeout)
                        .onErrorMap(error -> !(error instanceof StatusFetchException), this::mapException);
    }

    private StatusFetchException mapException(final Throwable error) {
        if (error instanceof WebClientResponseException responseException) {
            final HttpStatus status = HttpStatus.resolve(responseException.getStatusCode().value());
            final int code = responseException.getStatusCode().value();
            final boolean transientFailure = responseException.getStatusCode().is5xxServerError()
                                             || status == HttpStatus.TOO_MANY_REQUESTS;
            log.debug("Status request failed with HTTP {}.", code);
            return new StatusFetchException("Status request failed with HTTP " + code, code, transientFailure,
                                            error);
        }
        if (error instanceof WebClientRequestException || error instanceof TimeoutException) {
            return new StatusFetchException("Status request did not complete: " + error.getMessage(), null, true,
                                            error);
        }
        return new StatusFetchException("Status request failed: " + error.getMessage(), null, false, error);
    }
}
