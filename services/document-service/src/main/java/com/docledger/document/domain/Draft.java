package com.docledger.document.domain;

import com.docledger.document.converter.DocumentPayloadConverter;
import com.docledger.document.domain.payload.DocumentPayload;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Per-editor scratch copy of pending changes. At most one per (document, actor).
 */
@Entity
@Table(name = "document_drafts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_drafts_actor", columnNames = {"document_id", "actor_id"})
    },
    indexes = {
        @Index(name = "idx_document_drafts_tenant_actor", columnList = "tenant_id,actor_id"),
        @Index(name = "idx_document_drafts_updated", columnList = "updated_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Draft {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "document_id", nullable = false, updatable = false)
    private UUID documentId;

    @NotNull
    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @NotNull
    @Column(name = "actor_id", nullable = false, updatable = false, length = 64)
    private String actorId;

    @NotNull
    @Column(name = "baseline_version", nullable = false)
    private Integer baselineVersion;

    @NotNull
    @Convert(converter = DocumentPayloadConverter.class)
    @Column(name = "payload_delta", nullable = false, length = 1_000_000)
    private DocumentPayload payloadDelta;

    /**
     * Optional caller-supplied monotonic stamp; older or equal stamps are ignored on upsert.
     */
    @Column(name = "client_revision")
    private Long clientRevision;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isStale(int currentVersion) {
        return baselineVersion != currentVersion;
    }
}
