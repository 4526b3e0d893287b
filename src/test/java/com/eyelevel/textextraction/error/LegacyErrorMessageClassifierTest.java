package com.eyelevel.textextraction.error;

import com.eyelevel.textextraction.model.ErrorKind;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;

import static org.assertj.core.api.Assertions.assertThat;

class LegacyErrorMessageClassifierTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Invalid job id supplied                  | INVALID_JOB_REFERENCE",
            "The job has expired                      | INVALID_JOB_REFERENCE",
            "File is CORRUPTED                        | DOCUMENT_CORRUPTED",
            "Document is password protected           | DOCUMENT_PROTECTED",
            "File size exceeds the limit              | DOCUMENT_TOO_LARGE",
            "Unsupported content                      | UNSUPPORTED_FORMAT",
            "No text could be found                   | EMPTY_RESULT",
            "Operation timed out                      | TIMEOUT",
            "Network connection reset by peer         | TRANSIENT_NETWORK_ERROR",
            "Something odd happened                   | EXTERNAL_SERVICE_ERROR"
    })
    void messageKeywordsSelectKind(String message, ErrorKind expected) {
        assertThat(LegacyErrorMessageClassifier.classify(message)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void missingMessageIsServiceError(String message) {
        assertThat(LegacyErrorMessageClassifier.classify(message)).isEqualTo(ErrorKind.EXTERNAL_SERVICE_ERROR);
    }
}
