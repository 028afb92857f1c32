package com.docledger.document.metrics;

import com.docledger.document.domain.DocumentType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Micrometer meters for promotions, allocation and draft housekeeping.
 */
@Component
@RequiredArgsConstructor
public class DocumentMetrics {

    private final MeterRegistry meterRegistry;

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordOperation(Timer.Sample sample, String operation, String outcome) {
        sample.stop(Timer.builder("documents.operation.duration")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .register(meterRegistry));
        Counter.builder("documents.operation")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }

    public void lockTimeout(String operation) {
        Counter.builder("documents.lock.timeout")
            .tag("operation", operation)
            .register(meterRegistry)
            .increment();
    }

    public void sequenceAllocated(DocumentType type) {
        Counter.builder("documents.sequence.allocated")
            .tag("type", type.name())
            .register(meterRegistry)
            .increment();
    }

    public void sequenceDuplicate(DocumentType type) {
        Counter.builder("documents.sequence.duplicate")
            .tag("type", type.name())
            .register(meterRegistry)
            .increment();
    }

    public void draftsPurged(int count) {
        Counter.builder("documents.drafts.purged")
            .register(meterRegistry)
            .increment(count);
    }

    public void eventPublishFailed(String eventType) {
        Counter.builder("documents.events.failed")
            .tag("type", eventType)
            .register(meterRegistry)
            .increment();
    }
}
