package com.docledger.document.store;

import com.docledger.common.audit.SecurityEventLogger;
import com.docledger.common.tenant.TenantContext;
import com.docledger.common.tenant.TenantMismatchException;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.IssuedDocumentNumber;
import com.docledger.document.domain.SequenceCounterId;
import com.docledger.document.domain.VersionRecord;
import com.docledger.document.exception.DocumentNotFoundException;
import com.docledger.document.repository.DocumentRepository;
import com.docledger.document.repository.DocumentSpecifications;
import com.docledger.document.repository.DraftRepository;
import com.docledger.document.repository.IssuedDocumentNumberRepository;
import com.docledger.document.repository.SequenceCounterRepository;
import com.docledger.document.repository.VersionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;

/**
 * Persistence façade for the versioning engine.
 *
 * <p>Exposes the atomic primitives the engine is built on: row lock and read of a document,
 * increment-and-return of a sequence counter and unique-keyed inserts. Every access is scoped
 * to a tenant; a document that exists under another tenant raises {@link TenantMismatchException}
 * and is reported to the security audit log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentStore {

    private static final String DOCUMENT = "Document";

    private final DocumentRepository documentRepository;
    private final VersionRecordRepository versionRecordRepository;
    private final DraftRepository draftRepository;
    private final SequenceCounterRepository sequenceCounterRepository;
    private final IssuedDocumentNumberRepository issuedDocumentNumberRepository;
    private final SecurityEventLogger securityEventLogger;
    private final LockWaitLimiter lockWaitLimiter;
    private final Clock clock;

    // ===== Documents =====

    /**
     * Read a document and hold its row lock until the surrounding transaction ends.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Document lockDocument(TenantContext caller, UUID documentId) {
        lockWaitLimiter.apply();
        Document document = documentRepository.findByIdForUpdate(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return verifyTenant(caller, document);
    }

    @Transactional(readOnly = true)
    public Document findDocument(TenantContext caller, UUID documentId) {
        Document document = documentRepository.findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
        return verifyTenant(caller, document);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Document insertDocument(Document document) {
        return documentRepository.save(document);
    }

    @Transactional(readOnly = true)
    public Page<Document> searchDocuments(String tenantId, DocumentStatus status, String searchTerm, Pageable pageable) {
        Specification<Document> criteria = DocumentSpecifications.ownedBy(tenantId);
        if (status != null) {
            criteria = criteria.and(DocumentSpecifications.hasStatus(status));
        }
        if (searchTerm != null && !searchTerm.isBlank()) {
            criteria = criteria.and(DocumentSpecifications.matches(searchTerm));
        }
        return documentRepository.findAll(criteria, pageable);
    }

    // ===== Version ledger =====

    @Transactional(propagation = Propagation.MANDATORY)
    public VersionRecord insertVersion(VersionRecord record) {
        return versionRecordRepository.save(record);
    }

    @Transactional(readOnly = true)
    public Optional<VersionRecord> findVersion(String tenantId, UUID documentId, int versionNumber) {
        return versionRecordRepository.findByTenantIdAndDocumentIdAndVersionNumber(tenantId, documentId, versionNumber);
    }

    @Transactional(readOnly = true)
    public Page<VersionRecord> findVersions(String tenantId, UUID documentId, Pageable pageable) {
        return versionRecordRepository.findByTenantIdAndDocumentIdOrderByVersionNumberDesc(tenantId, documentId, pageable);
    }

    // ===== Drafts =====

    @Transactional(readOnly = true)
    public Optional<Draft> findDraft(String tenantId, UUID documentId, String actorId) {
        return draftRepository.findByTenantIdAndDocumentIdAndActorId(tenantId, documentId, actorId);
    }

    @Transactional(readOnly = true)
    public List<Draft> findDraftsByActor(String tenantId, String actorId) {
        return draftRepository.findByTenantIdAndActorIdOrderByUpdatedAtDesc(tenantId, actorId);
    }

    /**
     * Insert or update a draft. Flushes immediately so a concurrent first insert for the
     * same (document, actor) surfaces here as a unique-key violation.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Draft saveDraft(Draft draft) {
        return draftRepository.saveAndFlush(draft);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteDraft(String tenantId, UUID documentId, String actorId) {
        return draftRepository.deleteDraft(tenantId, documentId, actorId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteDraftsUpdatedBefore(LocalDateTime cutoff) {
        return draftRepository.deleteByUpdatedAtBefore(cutoff);
    }

    // ===== Sequence counters =====

    /**
     * Increment the counter and return the value this caller owns. The UPDATE row-locks the
     * counter until commit, so the following read sees this transaction's own increment.
     * Empty when the counter has not been provisioned.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OptionalLong incrementCounter(String tenantId, DocumentType type) {
        lockWaitLimiter.apply();
        int updated = sequenceCounterRepository.incrementNextNumber(tenantId, type.name(), LocalDateTime.now(clock));
        if (updated == 0) {
            return OptionalLong.empty();
        }
        Long next = sequenceCounterRepository.findNextNumber(tenantId, type.name());
        return OptionalLong.of(next - 1);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void insertCounterIfAbsent(String tenantId, DocumentType type) {
        sequenceCounterRepository.insertIfAbsent(tenantId, type.name(), LocalDateTime.now(clock));
    }

    /**
     * Create the counter in its own transaction so the row is visible to every caller once this returns.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void createCounter(String tenantId, DocumentType type) {
        int inserted = sequenceCounterRepository.insertIfAbsent(tenantId, type.name(), LocalDateTime.now(clock));
        if (inserted > 0) {
            log.info("Provisioned sequence counter tenant={} type={}", tenantId, type);
        }
    }

    @Transactional(readOnly = true)
    public boolean counterExists(String tenantId, DocumentType type) {
        return sequenceCounterRepository.existsById(new SequenceCounterId(tenantId, type.name()));
    }

    /**
     * Record an issued number. Flushes so a unique-key violation surfaces to the caller.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IssuedDocumentNumber recordIssuedNumber(IssuedDocumentNumber issued) {
        return issuedDocumentNumberRepository.saveAndFlush(issued);
    }

    private Document verifyTenant(TenantContext caller, Document document) {
        if (!document.getTenantId().equals(caller.getTenantId())) {
            securityEventLogger.tenantMismatch(caller, DOCUMENT, String.valueOf(document.getId()), document.getTenantId());
            throw new TenantMismatchException(caller.getTenantId(), DOCUMENT, String.valueOf(document.getId()));
        }
        return document;
    }
}
