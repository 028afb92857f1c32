package com.docledger.document.event;

import com.docledger.document.domain.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Raises document events inside the current transaction. Delivery happens only after commit,
 * see {@link DocumentEventRelay}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentEventPublisher {

    private static final String SOURCE = "document-service";

    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public void publish(DocumentEventType type, Document document, String actorId, List<String> changedFields) {
        DocumentEvent event = DocumentEvent.builder()
            .eventId(UUID.randomUUID().toString())
            .eventType(type)
            .documentId(document.getId())
            .tenantId(document.getTenantId())
            .documentType(document.getDocumentType().name())
            .documentNumber(document.getDocumentNumber())
            .actorId(actorId)
            .version(document.getVersion())
            .status(document.getStatus().getValue())
            .changedFields(changedFields != null ? List.copyOf(changedFields) : List.of())
            .occurredAt(clock.instant())
            .source(SOURCE)
            .build();
        log.debug("Raising {} for document {} at version {}", type, document.getId(), document.getVersion());
        applicationEventPublisher.publishEvent(event);
    }
}
