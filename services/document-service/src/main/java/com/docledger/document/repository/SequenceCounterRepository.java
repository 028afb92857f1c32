package com.docledger.document.repository;

import com.docledger.document.domain.SequenceCounter;
import com.docledger.document.domain.SequenceCounterId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * Sequence Counter Repository
 * The counter is only changed by {@link #incrementNextNumber}, which row-locks the counter
 * until the calling transaction ends.
 */
@Repository
public interface SequenceCounterRepository extends JpaRepository<SequenceCounter, SequenceCounterId> {

    /**
     * Atomically advance the counter; returns the number of rows touched (0 when not provisioned)
     */
    @Modifying(flushAutomatically = true)
    @Query(value = """
        UPDATE sequence_counters
        SET next_number = next_number + 1,
            updated_at = :now
        WHERE tenant_id = :tenantId
          AND document_type = :documentType
        """, nativeQuery = true)
    int incrementNextNumber(@Param("tenantId") String tenantId,
                            @Param("documentType") String documentType,
                            @Param("now") LocalDateTime now);

    /**
     * Read the counter; after {@link #incrementNextNumber} in the same transaction this is the caller's own value
     */
    @Query(value = """
        SELECT next_number FROM sequence_counters
        WHERE tenant_id = :tenantId AND document_type = :documentType
        """, nativeQuery = true)
    Long findNextNumber(@Param("tenantId") String tenantId,
                        @Param("documentType") String documentType);

    /**
     * Create the counter at 1 unless it already exists
     */
    @Modifying
    @Query(value = """
        INSERT INTO sequence_counters (tenant_id, document_type, next_number, updated_at)
        VALUES (:tenantId, :documentType, 1, :now)
        ON CONFLICT DO NOTHING
        """, nativeQuery = true)
    int insertIfAbsent(@Param("tenantId") String tenantId,
                       @Param("documentType") String documentType,
                       @Param("now") LocalDateTime now);
}
