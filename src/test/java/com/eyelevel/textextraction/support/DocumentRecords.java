package com.eyelevel.textextraction.support;

import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorInfo;
import com.eyelevel.textextraction.model.SourceKind;

import java.time.Instant;

/**
 * Ready-made records in each lifecycle state.
 */
public final class DocumentRecords {

    private DocumentRecords() {
    }

    public static DocumentRecord processing(String id, String jobRef, Instant createdAt) {
        return base(id, createdAt).status(DocumentStatus.PROCESSING)
                                  .sourceKind(SourceKind.ASYNCHRONOUS_JOB)
                                  .format("pdf")
                                  .fileName(id + ".pdf")
                                  .externalJobRef(jobRef)
                                  .build();
    }

    public static DocumentRecord pendingAsync(String id, Instant createdAt) {
        return base(id, createdAt).status(DocumentStatus.PENDING)
                                  .sourceKind(SourceKind.ASYNCHRONOUS_JOB)
                                  .format("pdf")
                                  .fileName(id + ".pdf")
                                  .build();
    }

    public static DocumentRecord completedSync(String id, String text, Instant createdAt) {
        return base(id, createdAt).status(DocumentStatus.COMPLETED)
                                  .sourceKind(SourceKind.SYNCHRONOUS_TEXT)
                                  .format("txt")
                                  .fileName(id + ".txt")
                                  .extractedText(text)
                                  .build();
    }

    public static DocumentRecord failedAsync(String id, ErrorInfo errorInfo, Instant createdAt) {
        return base(id, createdAt).status(DocumentStatus.FAILED)
                                  .sourceKind(SourceKind.ASYNCHRONOUS_JOB)
                                  .format("pdf")
                                  .fileName(id + ".pdf")
                                  .externalJobRef("job-" + id)
                                  .errorKind(errorInfo.kind())
                                  .errorMessage(errorInfo.message())
                                  .errorRetryable(errorInfo.retryable())
                                  .attemptCount(3)
                                  .build();
    }

    private static DocumentRecord.DocumentRecordBuilder base(String id, Instant createdAt) {
        return DocumentRecord.builder()
                             .id(id)
                             .sizeBytes(2048)
                             .storageKey("documents/" + id + "/file")
                             .attemptCount(0)
                             .createdAt(createdAt)
                             .cycleStartedAt(createdAt)
                             .updatedAt(createdAt);
    }
}
