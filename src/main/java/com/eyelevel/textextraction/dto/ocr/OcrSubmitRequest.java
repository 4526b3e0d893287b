package com.eyelevel.textextraction.dto.ocr;

/**
 * Body of a job submission to the OCR service.
 *
 * @param clientReference our document id, echoed back by the service for correlation
 * @param fileName        original file name
 * @param format          canonical format code, e.g. {@code pdf}
 * @param sourceUrl       presigned URL the service downloads the artifact from
 */
public record OcrSubmitRequest(String clientReference, String fileName, String format, String sourceUrl) {
}
