package com.eyelevel.textextraction.exception.handler;

import com.eyelevel.textextraction.dto.common.ApiResponse;
import com.eyelevel.textextraction.exception.DocumentNotFoundException;
import com.eyelevel.textextraction.exception.DocumentProcessingException;
import com.eyelevel.textextraction.exception.RetryFailedException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts exceptions thrown from controllers into an {@link ApiResponse} with the matching HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    // --- 4xx Client Error Handlers ---

    @ExceptionHandler(DocumentProcessingException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(final DocumentProcessingException ex) {
        log.warn("Bad Request Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles a multipart request without the {@code file} part. (400 Bad Request)
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingPart(final MissingServletRequestPartException ex) {
        final String errorMessage = String.format("Required part '%s' is missing.", ex.getRequestPartName());
        log.warn("Handling MissingServletRequestPartException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("A file must be uploaded.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Object>> handleMissingServletRequestParameter(
            final MissingServletRequestParameterException ex) {
        final String errorMessage = String.format("Required parameter '%s' of type '%s' is missing.",
                                                  ex.getParameterName(), ex.getParameterType());
        log.warn("Handling MissingServletRequestParameterException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Required parameter is missing.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles validation errors from @Validated on path variables and request parameters. (400 Bad Request)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Object>> handleConstraintViolation(final ConstraintViolationException ex) {
        final String errors = ex.getConstraintViolations().stream().map(violation -> {
            final String path = violation.getPropertyPath().toString();
            return String.format("'%s': %s", path.substring(path.lastIndexOf('.') + 1), violation.getMessage());
        }).collect(Collectors.joining(", "));
        final String errorMessage = "Validation failed: " + errors;
        log.warn("Handling constraint violation exception: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Invalid input provided.", errorMessage),
                                    HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleDocumentNotFound(final DocumentNotFoundException ex) {
        log.warn("Document Not Found Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.NOT_FOUND);
    }

    /**
     * Handles invalid URLs that don't map to any controller. (404 Not Found)
     * Requires 'spring.mvc.throw-exception-if-no-handler-found=true'.
     */
    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ApiResponse<Object>> handleNoHandlerFound(final NoHandlerFoundException ex) {
        final String errorMessage = String.format("No endpoint %s found for %s", ex.getHttpMethod(),
                                                  ex.getRequestURL());
        log.warn("Handling NoHandlerFoundException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Resource not found.", errorMessage), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Object>> handleHttpRequestMethodNotSupported(
            final HttpRequestMethodNotSupportedException ex) {
        final String supportedMethods = String.join(", ", Objects.requireNonNullElse(ex.getSupportedMethods(),
                                                                                     new String[0]));
        final String errorMessage = String.format("Request method '%s' not supported. Supported methods are: %s",
                                                  ex.getMethod(), supportedMethods);
        log.warn("Handling HttpRequestMethodNotSupportedException: {}", errorMessage);
        return new ResponseEntity<>(ApiResponse.error("Method not allowed.", errorMessage),
                                    HttpStatus.METHOD_NOT_ALLOWED);
    }

    /**
     * Handles a retry of a document that is not in a retryable state. (409 Conflict)
     */
    @ExceptionHandler(RetryFailedException.class)
    public ResponseEntity<ApiResponse<Object>> handleRetryFailed(final RetryFailedException ex) {
        log.warn("Retry Failed Exception: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error(ex.getMessage()), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Object>> handleMaxUploadSize(final MaxUploadSizeExceededException ex) {
        log.warn("Upload rejected by the multipart limit: {}", ex.getMessage());
        return new ResponseEntity<>(ApiResponse.error("The uploaded file is too large."),
                                    HttpStatus.PAYLOAD_TOO_LARGE);
    }

    // --- 5xx Server Error Handlers ---

    /**
     * A final catch-all handler for any other unexpected exceptions. (500 Internal Server Error)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Object>> handleGenericException(final Exception ex) {
        log.error("An unexpected internal server error occurred", ex);
        return new ResponseEntity<>(ApiResponse.error(
                "An unexpected internal error occurred. Please contact support.", ex.getClass().getSimpleName()),
                                    HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
