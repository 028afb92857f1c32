package com.docledger.document.repository;

import com.docledger.document.domain.VersionRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Version Record Repository
 * Read and insert only; ledger rows are immutable.
 */
@Repository
public interface VersionRecordRepository extends JpaRepository<VersionRecord, UUID> {

    /**
     * Find one version of a document
     */
    Optional<VersionRecord> findByTenantIdAndDocumentIdAndVersionNumber(
        String tenantId, UUID documentId, Integer versionNumber);

    /**
     * Page through a document's history, newest first
     */
    Page<VersionRecord> findByTenantIdAndDocumentIdOrderByVersionNumberDesc(
        String tenantId, UUID documentId, Pageable pageable);
}
