package com.docledger.document.event;

import com.docledger.document.config.DocumentProperties;
import com.docledger.document.metrics.DocumentMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Forwards committed document events to Kafka. Rolled-back transactions publish nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "documents.events", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DocumentEventRelay {

    private final KafkaTemplate<String, DocumentEvent> kafkaTemplate;
    private final DocumentProperties properties;
    private final DocumentMetrics metrics;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDocumentEvent(DocumentEvent event) {
        String topic = properties.getEvents().getTopic();
        kafkaTemplate.send(topic, event.getDocumentId().toString(), event)
            .whenComplete((result, ex) -> {
                if (ex != null) {
                    metrics.eventPublishFailed(event.getEventType().name());
                    log.error("Failed to publish {} for document {} to {}",
                        event.getEventType(), event.getDocumentId(), topic, ex);
                } else {
                    log.debug("Published {} for document {} to {}", event.getEventType(), event.getDocumentId(), topic);
                }
            });
    }
}
