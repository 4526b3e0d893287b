package com.eyelevel.textextraction.model;

/**
 * How text is obtained for a record. Chosen once at ingestion.
 */
public enum SourceKind {
    SYNCHRONOUS_TEXT,
    ASYNCHRONOUS_JOB
}
