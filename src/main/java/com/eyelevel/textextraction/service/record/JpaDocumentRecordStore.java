package com.eyelevel.textextraction.service.record;

import com.eyelevel.textextraction.model.DocumentRecord;
import com.eyelevel.textextraction.model.DocumentStatus;
import com.eyelevel.textextraction.model.RecordPatch;
import com.eyelevel.textextraction.model.SourceKind;
import com.eyelevel.textextraction.repository.DocumentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link DocumentRecordStore} backed by Spring Data JPA. Each operation runs in its own transaction so
 * that a conflict or failure on one record never rolls back work on another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaDocumentRecordStore implements DocumentRecordStore {

    private final DocumentRecordRepository documentRecordRepository;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public DocumentRecord create(final DocumentRecord record) {
        record.verifyInvariants();
        if (documentRecordRepository.existsById(record.getId())) {
            throw new IllegalArgumentException("Document record " + record.getId() + " already exists.");
        }
        final DocumentRecord saved = documentRecordRepository.saveAndFlush(record);
        log.info("Created document record {} in status {} ({}).", saved.getId(), saved.getStatus(),
                 saved.getSourceKind());
        return saved;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<DocumentRecord> read(final String id) {
        return documentRecordRepository.findById(id);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DocumentRecord> compareAndUpdate(final DocumentRecord observed, final RecordPatch patch,
                                                     final Instant now) {
        final DocumentRecord next = patch.applyTo(observed, now);
        final int updated = documentRecordRepository.compareAndSet(
                observed.getId(),
                observed.getStatus(),
                observed.getAttemptCount(),
                next.getStatus(),
                next.getExternalJobRef(),
                next.getExtractedText(),
                next.getErrorKind(),
                next.getErrorMessage(),
                next.getErrorRetryable(),
                next.getAttemptCount(),
                next.getPollFailureCount(),
                next.getCycleStartedAt(),
                next.getUpdatedAt());

        if (updated == 0) {
            log.warn("Conditional update {} on record {} lost: expected status {} with attempt {}.",
                     patch.getType(), observed.getId(), observed.getStatus(), observed.getAttemptCount());
            return Optional.empty();
        }
        log.debug("Record {} moved {} -> {} (attempt {}).", observed.getId(), observed.getStatus(),
                  next.getStatus(), next.getAttemptCount());
        return Optional.of(next);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<DocumentRecord> queryByStatus(final Collection<DocumentStatus> statuses,
                                              final SourceKind sourceKind) {
        return documentRecordRepository.findAllByStatusInAndSourceKindOrderByCreatedAtAsc(statuses, sourceKind);
    }
}
