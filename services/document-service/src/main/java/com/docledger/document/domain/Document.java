package com.docledger.document.domain;

import com.docledger.document.converter.DocumentPayloadConverter;
import com.docledger.document.converter.DocumentStatusConverter;
import com.docledger.document.domain.payload.DocumentPayload;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A versioned business record owned by one tenant.
 *
 * <p>{@code version} is the business version and always equals the highest version number in
 * the document's ledger; it only moves through {@code VersionLedger}. {@code rowVersion} is the
 * JPA optimistic guard and changes on every row update, status changes included.
 */
@Entity
@Table(name = "documents",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_documents_tenant_number", columnNames = {"tenant_id", "document_number"})
    },
    indexes = {
        @Index(name = "idx_documents_tenant_status", columnList = "tenant_id,status"),
        @Index(name = "idx_documents_tenant_updated", columnList = "tenant_id,updated_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, updatable = false, length = 30)
    private DocumentType documentType;

    @NotNull
    @Column(name = "document_number", nullable = false, updatable = false, length = 60)
    private String documentNumber;

    @NotNull
    @Column(name = "owner_actor_id", nullable = false, length = 64)
    private String ownerActorId;

    @NotNull
    @Convert(converter = DocumentStatusConverter.class)
    @Column(name = "status", nullable = false, length = 20)
    private DocumentStatus status;

    @NotNull
    @Column(name = "version", nullable = false)
    private Integer version;

    @NotNull
    @Convert(converter = DocumentPayloadConverter.class)
    @Column(name = "payload", nullable = false, length = 1_000_000)
    private DocumentPayload payload;

    @Column(name = "title", length = 255)
    private String title;

    @Min(0)
    @Max(100)
    @Column(name = "completion_percentage", nullable = false)
    private Integer completionPercentage;

    @Version
    @Column(name = "row_version", nullable = false)
    private Long rowVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "archived_at")
    private LocalDateTime archivedAt;

    /**
     * Replaces the payload together with the values derived from it.
     */
    public void applyPayload(DocumentPayload newPayload) {
        this.payload = newPayload;
        this.title = newPayload.getTitle();
        this.completionPercentage = newPayload.getCompletionPercentage();
    }
}
