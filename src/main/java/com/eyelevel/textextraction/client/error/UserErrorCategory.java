package com.eyelevel.textextraction.client.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What the user is told happened, independent of which backend produced the error.
 */
@Getter
@AllArgsConstructor
public enum UserErrorCategory {
    UNSUPPORTED_FILE("Unsupported File Format"),
    SESSION_EXPIRED("Processing Session Expired"),
    SERVICE_UNAVAILABLE("Service Temporarily Unavailable"),
    CONNECTION_PROBLEM("Connection Error"),
    PROCESSING_TIMEOUT("Processing Timeout"),
    NO_TEXT_FOUND("No Text Content Found"),
    FILE_DAMAGED("Document Appears Corrupted"),
    FILE_PROTECTED("Document is Password Protected"),
    FILE_TOO_LARGE("File Too Large"),
    DOCUMENT_NOT_FOUND("Document Not Found"),
    MONITORING_TIMEOUT("Still Processing"),
    UNKNOWN("Unexpected Error");

    private final String title;
}
