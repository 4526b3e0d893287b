package com.eyelevel.textextraction.dto.ocr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OcrSubmitResponse(String jobId) {
}
