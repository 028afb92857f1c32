package com.docledger.document.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Notification of a committed document change, published to Kafka keyed by document id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentEvent {
    private String eventId;
    private DocumentEventType eventType;
    private UUID documentId;
    private String tenantId;
    private String documentType;
    private String documentNumber;
    private String actorId;
    private Integer version;
    private String status;
    private List<String> changedFields;
    private Instant occurredAt;
    private String source;
}
