package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import reactor.core.publisher.Mono;

/**
 * Non-blocking read of a document's public status.
 */
public interface StatusSource {

    /**
     * @return the current status, or an error signal carrying a {@link StatusFetchException}
     */
    Mono<DocumentStatusResponse> fetchStatus(String documentId);
}
