package com.docledger.document.service;

import com.docledger.document.domain.Document;
import com.docledger.document.domain.VersionRecord;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.exception.VersionNotFoundException;
import com.docledger.document.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only history of document snapshots.
 *
 * <p>Appending is the only way a document's {@code version} moves: the new record takes
 * {@code version + 1} of the row-locked document and the document is advanced to it in the
 * same transaction, so version numbers per document start at 1 and have no gaps or duplicates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VersionLedger {

    private final DocumentStore documentStore;
    private final Clock clock;

    /**
     * Record {@code snapshot} as the next version of {@code lockedDocument} and advance the document to it.
     * The caller must hold the document's row lock (or have just created it) in the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public VersionRecord appendVersion(Document lockedDocument, DocumentPayload snapshot, String changeSummary,
                                       List<String> changedFields, String actorId) {
        int nextVersion = lockedDocument.getVersion() + 1;
        LocalDateTime now = LocalDateTime.now(clock);

        VersionRecord record = documentStore.insertVersion(VersionRecord.builder()
            .documentId(lockedDocument.getId())
            .tenantId(lockedDocument.getTenantId())
            .versionNumber(nextVersion)
            .snapshot(snapshot)
            .changedFields(List.copyOf(changedFields))
            .changeSummary(changeSummary)
            .actorId(actorId)
            .createdAt(now)
            .build());

        lockedDocument.applyPayload(snapshot);
        lockedDocument.setVersion(nextVersion);
        lockedDocument.setUpdatedAt(now);

        log.debug("Appended version {} to document {} ({} changed fields)",
            nextVersion, lockedDocument.getId(), changedFields.size());
        return record;
    }

    /**
     * History newest first; {@code page} is 1-based.
     */
    @Transactional(readOnly = true)
    public Page<VersionRecord> getHistory(String tenantId, UUID documentId, int page, int limit) {
        return documentStore.findVersions(tenantId, documentId, PageRequest.of(page - 1, limit));
    }

    @Transactional(readOnly = true)
    public VersionRecord getVersion(String tenantId, UUID documentId, int versionNumber) {
        return documentStore.findVersion(tenantId, documentId, versionNumber)
            .orElseThrow(() -> new VersionNotFoundException(documentId, versionNumber));
    }

    @Transactional(readOnly = true)
    public DocumentPayload snapshotAt(String tenantId, UUID documentId, int versionNumber) {
        return getVersion(tenantId, documentId, versionNumber).getSnapshot();
    }
}
