package com.eyelevel.textextraction.controller;

import com.eyelevel.textextraction.dto.common.ApiResponse;
import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import com.eyelevel.textextraction.dto.document.IngestionResponse;
import com.eyelevel.textextraction.exception.DocumentProcessingException;
import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.service.ingestion.IngestionCommand;
import com.eyelevel.textextraction.service.ingestion.IngestionCoordinator;
import com.eyelevel.textextraction.service.retry.RetryService;
import com.eyelevel.textextraction.service.status.DocumentStatusService;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * REST controller for document upload, status reads and operator retries.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Validated
public class DocumentController implements DocumentApi {

    private final IngestionCoordinator ingestionCoordinator;
    private final DocumentStatusService documentStatusService;
    private final RetryService retryService;

    @Override
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<IngestionResponse>> uploadDocument(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "format", required = false) final String format) {

        if (file.isEmpty()) {
            throw new DocumentProcessingException("The uploaded file is empty.");
        }
        log.info("Received upload of '{}' ({} bytes, declared format: {}).", file.getOriginalFilename(),
                 file.getSize(), format);

        final byte[] content;
        try {
            content = file.getBytes();
        } catch (final IOException e) {
            throw new DocumentProcessingException("The uploaded file could not be read.", e);
        }
        final DocumentRecord record = ingestionCoordinator.ingest(
                new IngestionCommand(file.getOriginalFilename(), format, file.getContentType(), content));

        final ApiResponse<IngestionResponse> response = ApiResponse.success(
                new IngestionResponse(record.getId(), record.getStatus()),
                "Document accepted for text extraction.", HttpStatus.CREATED.value());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    @GetMapping("/{documentId}/status")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> getDocumentStatus(
            @PathVariable @NotBlank(message = "The document id cannot be empty.") final String documentId) {
        log.debug("Fetching status of document {}.", documentId);
        final DocumentStatusResponse status = documentStatusService.getStatus(documentId);
        return ResponseEntity.ok(ApiResponse.success(status, "Document status retrieved successfully.",
                                                     HttpStatus.OK.value()));
    }

    @Override
    @PostMapping("/{documentId}/retry")
    public ResponseEntity<ApiResponse<DocumentStatusResponse>> retryDocument(
            @PathVariable @NotBlank(message = "The document id cannot be empty.") final String documentId) {
        log.info("Retry requested for document {}.", documentId);
        final DocumentRecord record = retryService.retry(documentId);
        return ResponseEntity.ok(ApiResponse.success(DocumentStatusResponse.from(record),
                                                     "Retry initiated successfully.", HttpStatus.OK.value()));
    }
}
