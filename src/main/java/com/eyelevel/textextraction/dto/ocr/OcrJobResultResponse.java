package com.eyelevel.textextraction.dto.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrJobResultResponse(String jobId, String text, Integer pageCount) {
}
