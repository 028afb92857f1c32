package com.docledger.document.service;

import com.docledger.common.error.BusinessException;
import com.docledger.common.tenant.TenantContext;
import com.docledger.document.domain.Conflict;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.VersionRecord;
import com.docledger.document.dto.DocumentSummary;
import com.docledger.document.dto.DocumentWithDraft;
import com.docledger.document.dto.DraftSummary;
import com.docledger.document.dto.VersionComparison;
import com.docledger.document.dto.VersionSummary;
import com.docledger.document.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only views over documents, drafts and history. Each call is a single read-only
 * transaction, so a document and the conflict computed for it come from one snapshot.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DocumentQueryService {

    static final int MAX_PAGE_SIZE = 100;

    private final DocumentStore documentStore;
    private final DraftCache draftCache;
    private final VersionLedger versionLedger;
    private final ConflictDetector conflictDetector;
    private final PayloadDiffer payloadDiffer;

    public DocumentWithDraft getDocumentWithDraft(TenantContext caller, UUID documentId) {
        Document document = documentStore.findDocument(caller, documentId);
        Optional<Draft> draft = draftCache.findDraft(caller.getTenantId(), documentId, caller.getActorId());

        Conflict conflict = draft
            .flatMap(d -> conflictDetector.check(d.getBaselineVersion(), document.getVersion(),
                    () -> versionLedger.snapshotAt(caller.getTenantId(), documentId, d.getBaselineVersion()),
                    document.getPayload())
                .getConflict())
            .orElse(null);

        return DocumentWithDraft.builder()
            .document(document)
            .draft(draft.orElse(null))
            .conflict(conflict)
            .build();
    }

    public Page<DocumentSummary> listDocuments(TenantContext caller, DocumentStatus status, String searchTerm,
                                               int page, int limit) {
        checkPaging(page, limit);
        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by(Sort.Direction.DESC, "updatedAt"));
        return documentStore.searchDocuments(caller.getTenantId(), status, searchTerm, pageable)
            .map(DocumentSummary::from);
    }

    public Page<VersionSummary> listVersions(TenantContext caller, UUID documentId, int page, int limit) {
        checkPaging(page, limit);
        documentStore.findDocument(caller, documentId);
        return versionLedger.getHistory(caller.getTenantId(), documentId, page, limit).map(VersionSummary::from);
    }

    public VersionRecord getVersion(TenantContext caller, UUID documentId, int versionNumber) {
        documentStore.findDocument(caller, documentId);
        return versionLedger.getVersion(caller.getTenantId(), documentId, versionNumber);
    }

    public VersionComparison compareVersions(TenantContext caller, UUID documentId, int fromVersion, int toVersion) {
        documentStore.findDocument(caller, documentId);
        VersionRecord from = versionLedger.getVersion(caller.getTenantId(), documentId, fromVersion);
        VersionRecord to = versionLedger.getVersion(caller.getTenantId(), documentId, toVersion);
        return VersionComparison.builder()
            .documentId(documentId)
            .fromVersion(fromVersion)
            .toVersion(toVersion)
            .changedFields(payloadDiffer.diff(from.getSnapshot(), to.getSnapshot()))
            .build();
    }

    public List<DraftSummary> listDrafts(TenantContext caller) {
        List<DraftSummary> summaries = new ArrayList<>();
        for (Draft draft : draftCache.listDrafts(caller.getTenantId(), caller.getActorId())) {
            Document document = documentStore.findDocument(caller, draft.getDocumentId());
            summaries.add(DraftSummary.from(draft, document));
        }
        return summaries;
    }

    private static void checkPaging(int page, int limit) {
        if (page < 1) {
            throw BusinessException.invalidArgument("page must be 1 or greater");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw BusinessException.invalidArgument("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
    }
}
