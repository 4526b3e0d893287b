package com.eyelevel.textextraction.repository;

import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.ErrorKind;
import com.eyelevel.textextraction.model.SourceKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface DocumentRecordRepository extends JpaRepository<DocumentRecord, String> {

    List<DocumentRecord> findAllByStatusInAndSourceKindOrderByCreatedAtAsc(Collection<DocumentStatus> statuses,
                                                                           SourceKind sourceKind);

    /**
     * Writes the full mutable state of a record only if it still has the status and attempt count the
     * caller read. The JPQL lives in {@code META-INF/document-record-orm.xml}.
     *
     * @return 1 if the row was updated, 0 if another writer got there first
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(name = "DocumentRecord.compareAndSet")
    int compareAndSet(@Param("id") String id,
                      @Param("expectedStatus") DocumentStatus expectedStatus,
                      @Param("expectedAttemptCount") int expectedAttemptCount,
                      @Param("newStatus") DocumentStatus newStatus,
                      @Param("externalJobRef") String externalJobRef,
                      @Param("extractedText") String extractedText,
                      @Param("errorKind") ErrorKind errorKind,
                      @Param("errorMessage") String errorMessage,
                      @Param("errorRetryable") Boolean errorRetryable,
                      @Param("attemptCount") int attemptCount,
                      @Param("pollFailureCount") int pollFailureCount,
                      @Param("cycleStartedAt") Instant cycleStartedAt,
                      @Param("updatedAt") Instant updatedAt);
}
