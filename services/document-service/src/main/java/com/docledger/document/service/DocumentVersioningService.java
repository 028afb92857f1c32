package com.docledger.document.service;

import com.docledger.common.error.TransactionTimeoutException;
import com.docledger.common.tenant.TenantContext;
import com.docledger.common.tenant.TenantContextHolder;
import com.docledger.document.config.DocumentProperties;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.VersionRecord;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.dto.DocumentSummary;
import com.docledger.document.dto.DocumentWithDraft;
import com.docledger.document.dto.DraftSummary;
import com.docledger.document.dto.VersionComparison;
import com.docledger.document.dto.VersionSummary;
import com.docledger.document.exception.DocumentConflictException;
import com.docledger.document.exception.DocumentValidationException;
import com.docledger.document.exception.LockFailures;
import com.docledger.document.metrics.DocumentMetrics;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for the document versioning engine, consumed by the API layer.
 *
 * <p>Every call runs as the {@link TenantContext} bound to the current thread. Write operations
 * run their transaction inside a retry loop for lost row races; this class itself is not
 * transactional, so lock timeouts surface here after rollback and are reported as a retryable
 * {@link TransactionTimeoutException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentVersioningService {

    private final PromotionEngine promotionEngine;
    private final DraftCache draftCache;
    private final SequenceAllocator sequenceAllocator;
    private final DocumentQueryService queryService;
    private final RetryTemplate documentRetryTemplate;
    private final DocumentProperties properties;
    private final DocumentMetrics metrics;
    private final Clock clock;

    // ===== Documents =====

    public Document createDocument(DocumentType documentType, DocumentPayload initialPayload) {
        TenantContext caller = TenantContextHolder.require();
        sequenceAllocator.provisionCounter(caller.getTenantId(), documentType);
        return execute("create", null, () -> promotionEngine.createDocument(caller, documentType, initialPayload));
    }

    public DocumentWithDraft getDocumentWithDraft(UUID documentId) {
        return queryService.getDocumentWithDraft(TenantContextHolder.require(), documentId);
    }

    /**
     * @param statusFilter optional status value ({@code draft}, {@code completed}, {@code archived})
     * @param page         1-based page number
     */
    public Page<DocumentSummary> listDocuments(String statusFilter, String searchTerm, int page, int limit) {
        DocumentStatus status = statusFilter != null && !statusFilter.isBlank()
            ? DocumentStatus.fromValue(statusFilter)
            : null;
        return queryService.listDocuments(TenantContextHolder.require(), status, searchTerm, page, limit);
    }

    // ===== Drafts =====

    public Draft saveDraft(UUID documentId, DocumentPayload payloadDelta) {
        return saveDraft(documentId, payloadDelta, null);
    }

    /**
     * @param clientRevision optional per-draft monotonic stamp; stale stamps are ignored
     */
    public Draft saveDraft(UUID documentId, DocumentPayload payloadDelta, Long clientRevision) {
        TenantContext caller = TenantContextHolder.require();
        return execute("saveDraft", documentId,
            () -> draftCache.saveDraft(caller, documentId, payloadDelta, clientRevision));
    }

    public Draft rebaseDraft(UUID documentId) {
        TenantContext caller = TenantContextHolder.require();
        return execute("rebaseDraft", documentId, () -> draftCache.rebaseDraft(caller, documentId));
    }

    public void discardDraft(UUID documentId) {
        TenantContext caller = TenantContextHolder.require();
        execute("discardDraft", documentId, () -> {
            draftCache.discardDraft(caller, documentId);
            return null;
        });
    }

    public List<DraftSummary> listDrafts() {
        return queryService.listDrafts(TenantContextHolder.require());
    }

    /**
     * Housekeeping across all tenants; not bound to a caller.
     */
    public int purgeStaleDrafts(Duration olderThan) {
        int purged = draftCache.purgeStaleDrafts(LocalDateTime.now(clock).minus(olderThan));
        metrics.draftsPurged(purged);
        return purged;
    }

    // ===== Promotion and status =====

    public Document promoteDraft(UUID documentId) {
        TenantContext caller = TenantContextHolder.require();
        return execute("promote", documentId, () -> promotionEngine.promoteDraft(caller, documentId));
    }

    public Document completeDocument(UUID documentId) {
        TenantContext caller = TenantContextHolder.require();
        return execute("complete", documentId, () -> promotionEngine.completeDocument(caller, documentId));
    }

    public Document archiveDocument(UUID documentId) {
        TenantContext caller = TenantContextHolder.require();
        return execute("archive", documentId, () -> promotionEngine.archive(caller, documentId));
    }

    public Document restoreDocument(UUID documentId) {
        return restoreDocument(documentId, DocumentStatus.COMPLETED);
    }

    public Document restoreDocument(UUID documentId, DocumentStatus targetStatus) {
        TenantContext caller = TenantContextHolder.require();
        return execute("restore", documentId, () -> promotionEngine.restore(caller, documentId, targetStatus));
    }

    // ===== History =====

    public Page<VersionSummary> listVersions(UUID documentId, int page, int limit) {
        return queryService.listVersions(TenantContextHolder.require(), documentId, page, limit);
    }

    public VersionRecord getVersion(UUID documentId, int versionNumber) {
        return queryService.getVersion(TenantContextHolder.require(), documentId, versionNumber);
    }

    public VersionComparison compareVersions(UUID documentId, int fromVersion, int toVersion) {
        return queryService.compareVersions(TenantContextHolder.require(), documentId, fromVersion, toVersion);
    }

    public Document rollbackToVersion(UUID documentId, int versionNumber) {
        TenantContext caller = TenantContextHolder.require();
        return execute("rollback", documentId,
            () -> promotionEngine.rollbackToVersion(caller, documentId, versionNumber));
    }

    // ===== Numbering =====

    public String allocateDocumentNumber(DocumentType documentType) {
        TenantContext caller = TenantContextHolder.require();
        sequenceAllocator.provisionCounter(caller.getTenantId(), documentType);
        return execute("allocateNumber", null,
            () -> sequenceAllocator.allocateDocumentNumber(caller.getTenantId(), documentType));
    }

    private <T> T execute(String operation, UUID documentId, Supplier<T> action) {
        Timer.Sample sample = metrics.startTimer();
        String outcome = "error";
        try {
            T result = documentRetryTemplate.execute(context -> action.get());
            outcome = "success";
            return result;
        } catch (DocumentConflictException e) {
            outcome = "conflict";
            throw e;
        } catch (DocumentValidationException e) {
            outcome = "invalid";
            throw e;
        } catch (TransactionTimeoutException e) {
            outcome = "timeout";
            metrics.lockTimeout(operation);
            throw e;
        } catch (RuntimeException e) {
            if (!LockFailures.isLockTimeout(e)) {
                throw e;
            }
            outcome = "timeout";
            metrics.lockTimeout(operation);
            log.warn("Timed out during {} on document {}: {}", operation, documentId, e.getMessage());
            throw new TransactionTimeoutException(documentId != null ? "document:" + documentId : operation,
                properties.getLocking().getTransactionTimeoutSeconds(), e);
        } finally {
            metrics.recordOperation(sample, operation, outcome);
        }
    }
}
