package com.eyelevel.textextraction.controller;

import com.eyelevel.textextraction.dto.common.ApiResponse;
import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import com.eyelevel.textextraction.dto.document.IngestionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

@Tag(name = "Text Extraction", description = "Upload documents, read their extraction status and retry failed extractions.")
public interface DocumentApi {

    @Operation(summary = "Upload a document",
            description = "Stores the document and starts text extraction. Plain-text and office formats are extracted "
                          + "before the response is returned; PDFs and images are handed to the OCR service and the "
                          + "returned record is PROCESSING until a reconciliation pass finishes it.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Document record created.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Submitted to OCR", value = """
                                    {
                                        "displayMessage": "Document accepted for text extraction.",
                                        "response": {
                                            "id": "3f2c1a5e-8d2b-4c6f-9a1e-7b5d4c3a2f10",
                                            "status": "PROCESSING"
                                        },
                                        "showMessage": false,
                                        "statusCode": 201
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing or empty file.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "500", description = "Internal Server Error",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<IngestionResponse>> uploadDocument(
            @Parameter(description = "The document to extract text from.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Optional format declared by the caller; overrides detection from the file name.", example = "pdf")
            @RequestParam(value = "format", required = false) String format);

    @Operation(summary = "Get document status",
            description = "Returns the stored state of a document. Extracted text is included once the document is COMPLETED "
                          + "and error details once it is FAILED or TIMED_OUT.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Failed", value = """
                                    {
                                        "displayMessage": "Document status retrieved successfully.",
                                        "response": {
                                            "id": "3f2c1a5e-8d2b-4c6f-9a1e-7b5d4c3a2f10",
                                            "status": "FAILED",
                                            "fileName": "scan.pdf",
                                            "format": "pdf",
                                            "errorInfo": {
                                                "kind": "DOCUMENT_PROTECTED",
                                                "message": "This document is password-protected.",
                                                "retryable": false
                                            },
                                            "createdAt": "2024-05-02T10:15:30Z",
                                            "updatedAt": "2024-05-02T10:17:30Z"
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No document with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> getDocumentStatus(
            @Parameter(description = "Id returned by the upload.", required = true)
            @PathVariable String documentId);

    @Operation(summary = "Retry a failed document",
            description = "Starts a new extraction cycle for a document that is FAILED or TIMED_OUT with a retryable error.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Retry started.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Not Found - No document with this id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The document cannot be retried in its current state.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentStatusResponse>> retryDocument(
            @Parameter(description = "Id returned by the upload.", required = true)
            @PathVariable String documentId);
}
