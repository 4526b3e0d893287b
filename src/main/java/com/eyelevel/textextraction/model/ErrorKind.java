package com.eyelevel.textextraction.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Closed taxonomy of extraction errors. Each kind carries the default user-facing message, the
 * remediation hint and whether retrying the same artifact can help.
 */
@Getter
@AllArgsConstructor
public enum ErrorKind {
    UNSUPPORTED_FORMAT(
            "The document format is not supported.",
            "Please use PDF, DOCX, DOC or TXT format.",
            false),
    INVALID_JOB_REFERENCE(
            "The text extraction job expired or was invalid.",
            "Please upload the document again to restart the extraction process.",
            false),
    EXTERNAL_SERVICE_ERROR(
            "The text extraction service is temporarily unavailable.",
            "This is usually temporary. Please try again in a few minutes.",
            true),
    TRANSIENT_NETWORK_ERROR(
            "A network connection error occurred during processing.",
            "Check your internet connection and try again.",
            true),
    TIMEOUT(
            "Text extraction timed out. The document may be too large or complex.",
            "Try uploading a smaller document or split large documents into smaller sections.",
            true),
    EMPTY_RESULT(
            "No text content was found in the document.",
            "Ensure the document contains selectable text, not just images or scanned content.",
            false),
    DOCUMENT_CORRUPTED(
            "The document appears to be corrupted or damaged.",
            "Try opening the document in its native application and re-saving it, then upload again.",
            false),
    DOCUMENT_PROTECTED(
            "The document is password-protected or encrypted.",
            "Remove password protection from the document and upload again.",
            false),
    DOCUMENT_TOO_LARGE(
            "The document is too large for processing.",
            "Please use a smaller document or compress the file.",
            false);

    private final String defaultMessage;
    private final String remediationHint;
    private final boolean retryable;

    /**
     * Transient network errors only ever cause a skipped cycle and are never stored on a record.
     */
    public boolean isPersistable() {
        return this != TRANSIENT_NETWORK_ERROR;
    }
}
