package com.eyelevel.textextraction.service.job;

import com.eyelevel.textextraction.model.DocumentFormat;

/**
 * What the OCR service needs to start a job for one document.
 */
public record JobSubmission(String documentId, String fileName, DocumentFormat format, String sourceUrl) {
}
