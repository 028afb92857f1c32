package com.docledger.document.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Registry of every formatted number handed out, guarded by a unique key per tenant.
 */
@Entity
@Immutable
@Table(name = "document_numbers",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_document_numbers_tenant_number", columnNames = {"tenant_id", "document_number"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuedDocumentNumber {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Enumerated(EnumType.STRING)
    @Column(name = "document_type", nullable = false, length = 30)
    private DocumentType documentType;

    @Column(name = "document_number", nullable = false, length = 60)
    private String documentNumber;

    @Column(name = "sequence_value", nullable = false)
    private Long sequenceValue;

    @Column(name = "issued_at", nullable = false)
    private LocalDateTime issuedAt;
}
