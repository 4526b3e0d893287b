package com.eyelevel.textextraction.common.apiclient;

import com.eyelevel.textextraction.common.apiclient.authentication.Authentication;
import com.eyelevel.textextraction.common.apiclient.model.ApiRequest;
import com.eyelevel.textextraction.common.apiclient.model.ApiResponse;
import com.eyelevel.textextraction.common.apiclient.model.HeaderConfig;
import com.eyelevel.textextraction.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.*;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Base class for blocking clients of external JSON APIs. It builds the request from an
 * {@link ApiRequest}, applies authentication and configured headers, and turns every failure into an
 * {@link ApiException} whose type reflects the HTTP status, so callers can branch on the outcome
 * without touching WebClient types.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final HeaderConfig headerConfig;

    /**
     * Executes the request and waits for the response.
     *
     * @param apiRequest The request to send. Must not be null.
     *
     * @return The response of a 2xx call.
     *
     * @throws ApiException For any non-2xx response, connection problem or timeout.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.debug("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        try {
            WebClient.RequestBodySpec requestBodySpec = configureRequest(apiRequest);
            configureHeaders(apiRequest, requestBodySpec);
            configureBody(apiRequest, requestBodySpec);

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse)
                                                     .timeout(DEFAULT_TIMEOUT)
                                                     .onErrorMap(this::mapException)
                                                     .block();
            log.trace("Received apiResponse: {}", apiResponse);
            return apiResponse;
        } catch (ApiException e) {
            log.warn("API call {} {} failed with status {}: {}", apiRequest.getMethod(), apiRequest.getPath(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Unexpected exception during API call {} {}", apiRequest.getMethod(), apiRequest.getPath(), e);
            throw mapException(e);
        }
    }

    /**
     * Maps transport and response errors onto the {@link ApiException} hierarchy.
     */
    private RuntimeException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof ConnectException ||
            error instanceof UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());
        }
        if (error instanceof TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());
        }
        log.error("Unexpected API client error", error);
        return new ApiException("Internal API client error: " + error.getMessage(),
                                HttpStatus.INTERNAL_SERVER_ERROR.value());
    }

    private WebClient.RequestBodySpec configureRequest(ApiRequest apiRequest) {
        return webClient.method(apiRequest.getMethod()).uri(uriBuilder -> {
            uriBuilder.path(apiRequest.getPath());
            Optional.ofNullable(apiRequest.getQueryParams())
                    .ifPresent(params -> params.forEach(uriBuilder::queryParam));
            return uriBuilder.build(Optional.ofNullable(apiRequest.getPathVariables()).orElse(Collections.emptyMap()));
        });
    }

    /**
     * Applies authentication, the client-wide {@link HeaderConfig} and the per-request headers, in that
     * order, so a request can override a default header.
     */
    private void configureHeaders(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        Map<String, String> headers = new HashMap<>(apiRequest.getHeaders());
        authentication.applyAuthentication(headers);

        if (headerConfig != null && headerConfig.getHeaders() != null) {
            headerConfig.getHeaders().forEach(header -> requestBodySpec.header(header.getName(), header.getValue()));
        }
        headers.forEach(requestBodySpec::header);
        Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
    }

    private void configureBody(ApiRequest apiRequest, WebClient.RequestBodySpec requestBodySpec) {
        if (apiRequest.getBody() == null) {
            return;
        }
        MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
        requestBodySpec.contentType(contentType);
        try {
            requestBodySpec.body(BodyInserters.fromValue(apiRequest.getBody()));
        } catch (Exception e) {
            log.error("Invalid request body {}", e.getMessage());
            throw new BadRequestException("Invalid request body: " + e.getMessage());
        }
    }

    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (!response.statusCode().is2xxSuccessful()) {
            return response.bodyToMono(String.class)
                           .defaultIfEmpty("")
                           .flatMap(body -> Mono.error(createException(body, statusCode)));
        }
        Instant timestamp = Instant.now();
        return response.bodyToMono(byte[].class)
                       .defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder()
                                               .data(data)
                                               .contentType(response.headers().contentType().orElse(null))
                                               .statusCode(statusCode)
                                               .timestamp(timestamp)
                                               .build());
    }

    private ApiException createException(String body, int statusCode) {
        return switch (statusCode) {
            case 400 -> new BadRequestException(body);
            case 404 -> new NotFoundException(body);
            case 410 -> new GoneException(body);
            case 429 -> new TooManyRequestsException(body);
            case 503 -> new ServiceUnavailableException(body);
            case 504 -> new GatewayTimeoutException(body);
            default -> new ApiException(body, statusCode);
        };
    }
}
