package com.eyelevel.textextraction.service.record;

import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.model.SourceKind;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for document records. All mutation after creation is compare-and-set: a write
 * only lands if the record still matches the state the writer observed.
 */
public interface DocumentRecordStore {

    /**
     * Persists a new record.
     *
     * @param record a record satisfying {@link DocumentRecord#verifyInvariants()}
     * @return the stored record
     */
    DocumentRecord create(DocumentRecord record);

    Optional<DocumentRecord> read(String id);

    /**
     * Applies {@code patch} to the record if its status and attempt count still equal those of
     * {@code observed}.
     *
     * @param observed the state the caller read and based its decision on
     * @param patch    the transition to apply
     * @param now      timestamp written to {@code updatedAt}
     * @return the new state if the write landed, empty on conflict
     */
    Optional<DocumentRecord> compareAndUpdate(DocumentRecord observed, RecordPatch patch, Instant now);

    List<DocumentRecord> queryByStatus(Collection<DocumentStatus> statuses, SourceKind sourceKind);
}
