package com.eyelevel.textextraction.model;

import com.eyelevel.textextraction.exception.InvalidRecordStateException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * One ingested artifact and the state of its text extraction.
 *
 * <p>Rows are never updated through dirty checking. Every change after creation goes through the
 * conditional update in {@code DocumentRecordRepository}, keyed on the status and attempt count the
 * writer last read.
 */
@Entity
@Table(name = "document_record",
       indexes = @Index(name = "idx_document_record_status_kind", columnList = "status, source_kind"))
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {

    @Id
    @Column(length = 36, nullable = false, updatable = false)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DocumentStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_kind", nullable = false, updatable = false, length = 20)
    private SourceKind sourceKind;

    @Column(nullable = false, updatable = false)
    private String fileName;

    /**
     * Canonical {@link DocumentFormat} code, null when the declared format was not recognised.
     */
    @Column(updatable = false, length = 16)
    private String format;

    @Column(nullable = false, updatable = false)
    private long sizeBytes;

    /**
     * Location of the stored artifact, used by retries and by the OCR service.
     */
    @Column(updatable = false)
    private String storageKey;

    @Column
    private String externalJobRef;

    @Column(columnDefinition = "TEXT")
    private String extractedText;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private ErrorKind errorKind;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Column
    private Boolean errorRetryable;

    @Column(nullable = false)
    private int attemptCount;

    /**
     * Failed polls of the OCR job in the current attempt cycle. Cleared by a retry.
     */
    @Column(nullable = false)
    private int pollFailureCount;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Start of the current attempt cycle. Equal to {@link #createdAt} until a retry opens a new cycle.
     */
    @Column(nullable = false)
    private Instant cycleStartedAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Transient
    public ErrorInfo getErrorInfo() {
        if (errorKind == null) {
            return null;
        }
        return new ErrorInfo(errorKind, errorMessage, Boolean.TRUE.equals(errorRetryable));
    }

    @Transient
    public Optional<DocumentFormat> resolveFormat() {
        return DocumentFormat.fromCode(format);
    }

    @Transient
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Checks the structural invariants of a record:
     * <ul>
     *     <li>extracted text is present exactly when the status is {@link DocumentStatus#COMPLETED};</li>
     *     <li>error info is present exactly when the status is {@link DocumentStatus#FAILED} or
     *     {@link DocumentStatus#TIMED_OUT};</li>
     *     <li>a job reference only exists for {@link SourceKind#ASYNCHRONOUS_JOB} records, and a
     *     {@link DocumentStatus#PROCESSING} record always has one.</li>
     * </ul>
     *
     * @throws InvalidRecordStateException if any invariant is broken
     */
    public void verifyInvariants() {
        if (id == null || status == null || sourceKind == null) {
            throw new InvalidRecordStateException("Record is missing its id, status or source kind.");
        }
        boolean hasText = extractedText != null;
        boolean hasError = errorKind != null;
        if (hasText != (status == DocumentStatus.COMPLETED)) {
            throw new InvalidRecordStateException(
                    "Record " + id + " in status " + status + " has inconsistent extracted text.");
        }
        if (hasError != (status == DocumentStatus.FAILED || status == DocumentStatus.TIMED_OUT)) {
            throw new InvalidRecordStateException(
                    "Record " + id + " in status " + status + " has inconsistent error info.");
        }
        if (hasError && !errorKind.isPersistable()) {
            throw new InvalidRecordStateException("Error kind " + errorKind + " cannot be stored on a record.");
        }
        if (externalJobRef != null && sourceKind != SourceKind.ASYNCHRONOUS_JOB) {
            throw new InvalidRecordStateException("Record " + id + " has a job reference but is not an async job.");
        }
        if (status == DocumentStatus.PROCESSING && externalJobRef == null) {
            throw new InvalidRecordStateException("Record " + id + " is PROCESSING without a job reference.");
        }
    }
}
