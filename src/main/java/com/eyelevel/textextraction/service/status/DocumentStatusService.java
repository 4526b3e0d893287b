package com.eyelevel.textextraction.service.status;

import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import com.eyelevel.textextraction.exception.DocumentNotFoundException;
import com.eyelevel.textextraction.service.record.DocumentRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read side of the API. Reports what is stored and never triggers a poll of the OCR service.
 */
@Service
@RequiredArgsConstructor
public class DocumentStatusService {

    private final DocumentRecordStore documentRecordStore;

    public DocumentStatusResponse getStatus(final String documentId) {
        return documentRecordStore.read(documentId)
                                  .map(DocumentStatusResponse::from)
                                  .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }
}
