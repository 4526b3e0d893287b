package com.eyelevel.textextraction.service.extraction;

import com.eyelevel.textextraction.model.DocumentFormat;

/**
 * Synchronous, in-process text extractor for one or more document formats.
 */
public interface TextExtractor {

    /**
     * @param format the resolved document format
     * @return {@code true} if this extractor can read the format
     */
    boolean supports(DocumentFormat format);

    /**
     * Extracts plain text from the artifact.
     *
     * @param content the artifact bytes
     * @param format  the resolved document format
     * @return the extracted text, possibly blank
     * @throws com.eyelevel.textextraction.exception.ExtractionException with the matching error kind
     *                                                                   when the artifact cannot be read
     */
    String extract(byte[] content, DocumentFormat format);
}
