package com.docledger.document.service;

import com.docledger.document.config.DocumentProperties;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.IssuedDocumentNumber;
import com.docledger.document.exception.DuplicateSequenceException;
import com.docledger.document.metrics.DocumentMetrics;
import com.docledger.document.store.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.Year;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document Number Allocator
 *
 * Issues collision-free numbers per (tenant, document type) from a database counter that is
 * only ever advanced by a single atomic UPDATE. Formatted numbers look like
 * {@code PREFIX-YYYY-NNNN}, e.g. {@code CNS-2026-0042}; the sequence is never reset, so numbers
 * stay unique across years. Gaps are possible when a transaction rolls back, duplicates are not.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SequenceAllocator {

    private static final Pattern NUMBER_PATTERN = Pattern.compile("^([A-Z0-9]+)-(\\d{4})-(\\d{4,})$");

    private final DocumentStore documentStore;
    private final DocumentProperties properties;
    private final DocumentMetrics metrics;
    private final Clock clock;

    /**
     * Make sure the counter row exists before any allocation transaction needs it. Runs each
     * attempt in its own transaction, so call it outside of any open transaction.
     */
    public void provisionCounter(String tenantId, DocumentType type) {
        int attempts = properties.getNumbering().getProvisionAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (documentStore.counterExists(tenantId, type)) {
                return;
            }
            try {
                documentStore.createCounter(tenantId, type);
                return;
            } catch (DataAccessException e) {
                log.debug("Counter tenant={} type={} is being created concurrently (attempt {}): {}",
                    tenantId, type, attempt, e.getMessage());
                pause(attempt);
            }
        }
        log.warn("Counter tenant={} type={} not visible after {} attempts, allocation will create it in-transaction",
            tenantId, type, attempts);
    }

    /**
     * Allocate the next raw sequence value. Joins the caller's transaction; the counter row stays
     * locked until that transaction ends.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public long allocate(String tenantId, DocumentType type) {
        OptionalLong allocated = documentStore.incrementCounter(tenantId, type);
        if (allocated.isEmpty()) {
            documentStore.insertCounterIfAbsent(tenantId, type);
            allocated = documentStore.incrementCounter(tenantId, type);
        }
        long value = allocated.orElseThrow(() -> new IllegalStateException(
            "Sequence counter for tenant " + tenantId + " and type " + type + " could not be created"));
        metrics.sequenceAllocated(type);
        return value;
    }

    /**
     * Allocate and format the next document number, registering it under the tenant's unique key.
     */
    @Transactional(timeoutString = "${documents.locking.transaction-timeout-seconds:3}", rollbackFor = Exception.class)
    public String allocateDocumentNumber(String tenantId, DocumentType type) {
        long value = allocate(tenantId, type);
        String number = formatNumber(properties.getNumbering().prefixFor(type), Year.now(clock).getValue(), value);
        try {
            documentStore.recordIssuedNumber(IssuedDocumentNumber.builder()
                .tenantId(tenantId)
                .documentType(type)
                .documentNumber(number)
                .sequenceValue(value)
                .issuedAt(LocalDateTime.now(clock))
                .build());
        } catch (DataIntegrityViolationException e) {
            metrics.sequenceDuplicate(type);
            log.error("CRITICAL: sequence allocator issued an already used document number {} tenant={} type={} sequence={}",
                number, tenantId, type, value, e);
            throw new DuplicateSequenceException(tenantId, type, number, e);
        }
        log.info("Allocated document number {} for tenant {}", number, tenantId);
        return number;
    }

    public static String formatNumber(String prefix, int year, long sequence) {
        return String.format("%s-%d-%04d", prefix, year, sequence);
    }

    /**
     * Extract the raw sequence value from a formatted number.
     */
    public static long parseSequence(String documentNumber) {
        Matcher matcher = documentNumber != null ? NUMBER_PATTERN.matcher(documentNumber) : null;
        if (matcher == null || !matcher.matches()) {
            throw new IllegalArgumentException("Not a document number: " + documentNumber);
        }
        return Long.parseLong(matcher.group(3));
    }

    private static void pause(int attempt) {
        try {
            Thread.sleep(10L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while provisioning sequence counter", e);
        }
    }
}
