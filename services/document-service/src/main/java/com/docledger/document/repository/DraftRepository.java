package com.docledger.document.repository;

import com.docledger.document.domain.Draft;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Draft Repository
 */
@Repository
public interface DraftRepository extends JpaRepository<Draft, UUID> {

    Optional<Draft> findByTenantIdAndDocumentIdAndActorId(String tenantId, UUID documentId, String actorId);

    List<Draft> findByTenantIdAndActorIdOrderByUpdatedAtDesc(String tenantId, String actorId);

    @Modifying
    @Query("DELETE FROM Draft d WHERE d.tenantId = :tenantId AND d.documentId = :documentId AND d.actorId = :actorId")
    int deleteDraft(@Param("tenantId") String tenantId,
                    @Param("documentId") UUID documentId,
                    @Param("actorId") String actorId);

    /**
     * Remove drafts abandoned before the cutoff, across all tenants
     */
    @Modifying
    @Query("DELETE FROM Draft d WHERE d.updatedAt < :cutoff")
    int deleteByUpdatedAtBefore(@Param("cutoff") LocalDateTime cutoff);
}
