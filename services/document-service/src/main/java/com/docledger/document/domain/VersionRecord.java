package com.docledger.document.domain;

import com.docledger.document.converter.DocumentPayloadConverter;
import com.docledger.document.converter.StringListConverter;
import com.docledger.document.domain.payload.DocumentPayload;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One committed state of a document. Rows are inserted by the ledger and never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "document_versions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_versions_number", columnNames = {"document_id", "version_number"})
    },
    indexes = {
        @Index(name = "idx_document_versions_tenant", columnList = "tenant_id,document_id")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionRecord {

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
    @Column(name = "version_number", nullable = false, updatable = false)
    private Integer versionNumber;

    @NotNull
    @Convert(converter = DocumentPayloadConverter.class)
    @Column(name = "snapshot", nullable = false, updatable = false, length = 1_000_000)
    private DocumentPayload snapshot;

    @Convert(converter = StringListConverter.class)
    @Column(name = "changed_fields", nullable = false, updatable = false, length = 20_000)
    private List<String> changedFields;

    @Column(name = "change_summary", updatable = false, length = 500)
    private String changeSummary;

    @NotNull
    @Column(name = "actor_id", nullable = false, updatable = false, length = 64)
    private String actorId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
