package com.docledger.document.service;

import com.docledger.common.tenant.TenantContext;
import com.docledger.document.domain.ConflictCheck;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.VersionRecord;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.event.DocumentEventPublisher;
import com.docledger.document.event.DocumentEventType;
import com.docledger.document.exception.DocumentConflictException;
import com.docledger.document.exception.DraftNotFoundException;
import com.docledger.document.exception.InvalidStatusTransitionException;
import com.docledger.document.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives every change to a document's committed state.
 *
 * <p>Each operation is one transaction that starts by taking the document's row lock and ends
 * with commit, so two promotions can never both read the same version and both succeed. Any
 * failure after the lock rolls back everything: payload, version, status and draft removal.
 * Status policy: draft -> completed -> archived -> completed (or draft, only on explicit request).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromotionEngine {

    static final String INITIAL_VERSION_SUMMARY = "Initial version";

    private final DocumentStore documentStore;
    private final VersionLedger versionLedger;
    private final DraftCache draftCache;
    private final ConflictDetector conflictDetector;
    private final PayloadValidator payloadValidator;
    private final PayloadDiffer payloadDiffer;
    private final SequenceAllocator sequenceAllocator;
    private final DocumentEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Create a document in draft at version 1, numbered from the tenant's sequence for its type.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document createDocument(TenantContext caller, DocumentType type, DocumentPayload initialPayload) {
        DocumentPayload payload = initialPayload != null ? initialPayload : DocumentPayload.empty();
        payloadValidator.validateWellFormed(payload);

        String documentNumber = sequenceAllocator.allocateDocumentNumber(caller.getTenantId(), type);
        LocalDateTime now = LocalDateTime.now(clock);
        Document document = documentStore.insertDocument(Document.builder()
            .tenantId(caller.getTenantId())
            .documentType(type)
            .documentNumber(documentNumber)
            .ownerActorId(caller.getActorId())
            .status(DocumentStatus.DRAFT)
            .version(0)
            .payload(payload)
            .title(payload.getTitle())
            .completionPercentage(payload.getCompletionPercentage())
            .createdAt(now)
            .updatedAt(now)
            .build());

        versionLedger.appendVersion(document, payload, INITIAL_VERSION_SUMMARY,
            payloadDiffer.diff(DocumentPayload.empty(), payload), caller.getActorId());
        eventPublisher.publish(DocumentEventType.CREATED, document, caller.getActorId(), List.of());

        log.info("Created {} {} ({}) for tenant {} by {}",
            type, documentNumber, document.getId(), caller.getTenantId(), caller.getActorId());
        return document;
    }

    /**
     * Merge the caller's draft into the document as a new version. The document keeps its status;
     * promoting into a completed document re-applies the completion checks.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document promoteDraft(TenantContext caller, UUID documentId) {
        Document document = documentStore.lockDocument(caller, documentId);
        requireEditable(document, "promote a draft into");

        Draft draft = draftCache.findDraft(caller.getTenantId(), documentId, caller.getActorId())
            .orElseThrow(() -> new DraftNotFoundException(documentId, caller.getActorId()));
        List<String> changedFields = commitDraft(caller, document, draft, document.getStatus(), "Promoted draft");

        eventPublisher.publish(DocumentEventType.VERSION_COMMITTED, document, caller.getActorId(), changedFields);
        log.info("Promoted draft of {} into document {} version {}", caller.getActorId(), documentId, document.getVersion());
        return document;
    }

    /**
     * Complete a draft document: promote the caller's draft if there is one, require every section
     * the document type needs, append a version and move the status to completed. On validation
     * failure nothing changes.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document completeDocument(TenantContext caller, UUID documentId) {
        Document document = documentStore.lockDocument(caller, documentId);
        requireTransition(document, DocumentStatus.COMPLETED);

        Optional<Draft> draft = draftCache.findDraft(caller.getTenantId(), documentId, caller.getActorId());
        List<String> changedFields = List.of();
        if (draft.isPresent()) {
            changedFields = commitDraft(caller, document, draft.get(), DocumentStatus.COMPLETED, "Completed document");
        } else {
            DocumentPayload current = document.getPayload();
            payloadValidator.validateForCompletion(document.getDocumentType(), current);
            versionLedger.appendVersion(document, current, "Completed document", List.of(), caller.getActorId());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        document.setStatus(DocumentStatus.COMPLETED);
        document.setCompletedAt(now);
        document.setUpdatedAt(now);

        eventPublisher.publish(DocumentEventType.COMPLETED, document, caller.getActorId(), changedFields);
        log.info("Completed document {} at version {} by {}", documentId, document.getVersion(), caller.getActorId());
        return document;
    }

    /**
     * Restore an earlier snapshot by committing it as a new version. Earlier versions are untouched
     * and drafts are left alone; they become stale and will conflict on promotion.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document rollbackToVersion(TenantContext caller, UUID documentId, int versionNumber) {
        Document document = documentStore.lockDocument(caller, documentId);
        requireEditable(document, "roll back");

        VersionRecord target = versionLedger.getVersion(caller.getTenantId(), documentId, versionNumber);
        DocumentPayload restored = target.getSnapshot();
        payloadValidator.validateFor(document.getStatus(), document.getDocumentType(), restored);

        List<String> changedFields = payloadDiffer.diff(document.getPayload(), restored);
        int fromVersion = document.getVersion();
        versionLedger.appendVersion(document, restored, "Rolled back to version " + versionNumber,
            changedFields, caller.getActorId());

        eventPublisher.publish(DocumentEventType.ROLLED_BACK, document, caller.getActorId(), changedFields);
        log.info("Rolled back document {} from version {} to snapshot {} as version {} by {}",
            documentId, fromVersion, versionNumber, document.getVersion(), caller.getActorId());
        return document;
    }

    /**
     * completed -> archived. No version is appended.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document archive(TenantContext caller, UUID documentId) {
        Document document = documentStore.lockDocument(caller, documentId);
        requireTransition(document, DocumentStatus.ARCHIVED);

        LocalDateTime now = LocalDateTime.now(clock);
        document.setStatus(DocumentStatus.ARCHIVED);
        document.setArchivedAt(now);
        document.setUpdatedAt(now);

        eventPublisher.publish(DocumentEventType.ARCHIVED, document, caller.getActorId(), List.of());
        log.info("Archived document {} by {}", documentId, caller.getActorId());
        return document;
    }

    /**
     * archived -> {@code targetStatus} (completed unless the caller explicitly asks for draft).
     * No version is appended.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public Document restore(TenantContext caller, UUID documentId, DocumentStatus targetStatus) {
        DocumentStatus target = targetStatus != null ? targetStatus : DocumentStatus.COMPLETED;
        Document document = documentStore.lockDocument(caller, documentId);
        if (document.getStatus() != DocumentStatus.ARCHIVED) {
            throw InvalidStatusTransitionException.transition(documentId, document.getStatus(), target);
        }
        requireTransition(document, target);

        document.setStatus(target);
        document.setArchivedAt(null);
        document.setUpdatedAt(LocalDateTime.now(clock));

        eventPublisher.publish(DocumentEventType.RESTORED, document, caller.getActorId(), List.of());
        log.info("Restored document {} to {} by {}", documentId, target.getValue(), caller.getActorId());
        return document;
    }

    /**
     * Conflict check, merge, validation for {@code targetStatus}, version append and draft removal,
     * all against the locked document. Returns the changed payload paths.
     */
    private List<String> commitDraft(TenantContext caller, Document document, Draft draft,
                             DocumentStatus targetStatus, String changeSummary) {
        ConflictCheck check = conflictDetector.check(draft.getBaselineVersion(), document.getVersion(),
            () -> versionLedger.snapshotAt(caller.getTenantId(), document.getId(), draft.getBaselineVersion()),
            document.getPayload());
        if (!check.isClean()) {
            DocumentConflictException conflict = new DocumentConflictException(document.getId(), check.getConflict().get());
            log.warn("Rejected promotion of document {} by {}: draft version {} behind current version {}",
                document.getId(), caller.getActorId(), conflict.getDraftVersion(), conflict.getCurrentVersion());
            throw conflict;
        }

        DocumentPayload merged = document.getPayload().mergeWith(draft.getPayloadDelta());
        payloadValidator.validateFor(targetStatus, document.getDocumentType(), merged);

        List<String> changedFields = payloadDiffer.diff(document.getPayload(), merged);
        versionLedger.appendVersion(document, merged, changeSummary, changedFields, caller.getActorId());
        draftCache.deleteDraft(caller.getTenantId(), document.getId(), caller.getActorId());
        return changedFields;
    }

    private void requireEditable(Document document, String operation) {
        if (!document.getStatus().isEditable()) {
            throw InvalidStatusTransitionException.notEditable(document.getId(), document.getStatus(), operation);
        }
    }

    private void requireTransition(Document document, DocumentStatus target) {
        if (!document.getStatus().canTransitionTo(target)) {
            throw InvalidStatusTransitionException.transition(document.getId(), document.getStatus(), target);
        }
    }
}
