package com.docledger.document.service;

import com.docledger.common.tenant.TenantContext;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.exception.DraftNotFoundException;
import com.docledger.document.exception.InvalidStatusTransitionException;
import com.docledger.document.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-(document, actor) staging area for in-progress edits.
 *
 * <p>Draft writes never take the document lock; the document version is read once when the
 * draft is created (or rebased) and becomes the draft's baseline. Staleness of that baseline
 * is what the conflict check at promotion time catches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftCache {

    private final DocumentStore documentStore;
    private final PayloadValidator payloadValidator;
    private final Clock clock;

    /**
     * Save the caller's edits to a document. Sections in {@code payloadDelta} replace the ones
     * already staged; the baseline of an existing draft is kept.
     */
    @Transactional(rollbackFor = Exception.class)
    public Draft saveDraft(TenantContext caller, UUID documentId, DocumentPayload payloadDelta, Long clientRevision) {
        Document document = documentStore.findDocument(caller, documentId);
        if (!document.getStatus().isEditable()) {
            throw InvalidStatusTransitionException.notEditable(documentId, document.getStatus(), "edit");
        }
        payloadValidator.validateWellFormed(payloadDelta);
        return upsertDraft(caller.getTenantId(), documentId, caller.getActorId(), payloadDelta,
            document.getVersion(), clientRevision);
    }

    /**
     * Insert or update the draft for (document, actor). Idempotent: saving identical content only
     * moves {@code updatedAt}. An upsert carrying a {@code clientRevision} that is not newer than the
     * stored one is ignored and the stored draft returned.
     */
    @Transactional(rollbackFor = Exception.class)
    public Draft upsertDraft(String tenantId, UUID documentId, String actorId, DocumentPayload payloadDelta,
                             int baselineVersion, Long clientRevision) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Draft> existing = documentStore.findDraft(tenantId, documentId, actorId);

        if (existing.isPresent()) {
            Draft draft = existing.get();
            if (clientRevision != null && draft.getClientRevision() != null
                    && clientRevision <= draft.getClientRevision()) {
                log.debug("Ignoring out-of-order autosave for document {} actor {}: revision {} <= {}",
                    documentId, actorId, clientRevision, draft.getClientRevision());
                return draft;
            }
            draft.setPayloadDelta(draft.getPayloadDelta().mergeWith(payloadDelta));
            if (clientRevision != null) {
                draft.setClientRevision(clientRevision);
            }
            draft.setUpdatedAt(now);
            log.debug("Updated draft for document {} actor {} (baseline {})",
                documentId, actorId, draft.getBaselineVersion());
            return documentStore.saveDraft(draft);
        }

        Draft created = documentStore.saveDraft(Draft.builder()
            .documentId(documentId)
            .tenantId(tenantId)
            .actorId(actorId)
            .baselineVersion(baselineVersion)
            .payloadDelta(DocumentPayload.empty().mergeWith(payloadDelta))
            .clientRevision(clientRevision)
            .createdAt(now)
            .updatedAt(now)
            .build());
        log.debug("Created draft for document {} actor {} at baseline {}", documentId, actorId, baselineVersion);
        return created;
    }

    @Transactional(readOnly = true)
    public Optional<Draft> findDraft(String tenantId, UUID documentId, String actorId) {
        return documentStore.findDraft(tenantId, documentId, actorId);
    }

    @Transactional(readOnly = true)
    public Draft getDraft(String tenantId, UUID documentId, String actorId) {
        return findDraft(tenantId, documentId, actorId)
            .orElseThrow(() -> new DraftNotFoundException(documentId, actorId));
    }

    /**
     * Move the caller's draft onto the document's current version, keeping its staged sections.
     * Used after the caller has reviewed a conflict and chosen to overwrite or re-merge.
     */
    @Transactional(rollbackFor = Exception.class)
    public Draft rebaseDraft(TenantContext caller, UUID documentId) {
        Document document = documentStore.findDocument(caller, documentId);
        if (!document.getStatus().isEditable()) {
            throw InvalidStatusTransitionException.notEditable(documentId, document.getStatus(), "edit");
        }
        Draft draft = getDraft(caller.getTenantId(), documentId, caller.getActorId());
        int previousBaseline = draft.getBaselineVersion();
        draft.setBaselineVersion(document.getVersion());
        draft.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Rebased draft for document {} actor {} from version {} to {}",
            documentId, caller.getActorId(), previousBaseline, document.getVersion());
        return documentStore.saveDraft(draft);
    }

    /**
     * Remove the caller's draft. Discarding a draft that does not exist is a no-op.
     */
    @Transactional(rollbackFor = Exception.class)
    public void discardDraft(TenantContext caller, UUID documentId) {
        documentStore.findDocument(caller, documentId);
        int removed = deleteDraft(caller.getTenantId(), documentId, caller.getActorId());
        log.debug("Discarded {} draft(s) for document {} actor {}", removed, documentId, caller.getActorId());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public int deleteDraft(String tenantId, UUID documentId, String actorId) {
        return documentStore.deleteDraft(tenantId, documentId, actorId);
    }

    @Transactional(readOnly = true)
    public List<Draft> listDrafts(String tenantId, String actorId) {
        return documentStore.findDraftsByActor(tenantId, actorId);
    }

    /**
     * Delete drafts across all tenants that have not been saved since {@code cutoff}.
     */
    @Transactional(rollbackFor = Exception.class)
    public int purgeStaleDrafts(LocalDateTime cutoff) {
        int purged = documentStore.deleteDraftsUpdatedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} drafts not updated since {}", purged, cutoff);
        }
        return purged;
    }
}
