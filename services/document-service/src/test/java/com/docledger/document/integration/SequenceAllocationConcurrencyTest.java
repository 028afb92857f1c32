package com.docledger.document.integration;

import com.docledger.document.BaseIntegrationTest;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.repository.IssuedDocumentNumberRepository;
import com.docledger.document.service.DocumentVersioningService;
import com.docledger.document.service.SequenceAllocator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Parallel number allocation for a tenant whose counter does not exist yet.
 */
@DisplayName("Sequence Allocation Concurrency Tests")
class SequenceAllocationConcurrencyTest extends BaseIntegrationTest {

    private static final int CALLERS = 50;

    @Autowired
    private DocumentVersioningService service;

    @Autowired
    private IssuedDocumentNumberRepository issuedDocumentNumberRepository;

    @Test
    @DisplayName("Should hand out 1..N exactly once to N concurrent callers")
    void shouldAllocateDistinctContiguousNumbers() throws Exception {
        // Arrange
        ExecutorService executor = Executors.newFixedThreadPool(CALLERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> futures = new ArrayList<>();

        // Act
        try {
            for (int i = 0; i < CALLERS; i++) {
                String actor = "clerk-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return as(actor, () -> service.allocateDocumentNumber(DocumentType.INVOICE));
                }));
            }
            start.countDown();
            List<String> numbers = new ArrayList<>();
            for (Future<String> future : futures) {
                numbers.add(future.get(60, TimeUnit.SECONDS));
            }

            // Assert
            assertThat(numbers).doesNotHaveDuplicates().allMatch(number -> number.startsWith("INV-2026-"));
            Set<Long> sequences = numbers.stream().map(SequenceAllocator::parseSequence).collect(Collectors.toSet());
            assertThat(sequences).isEqualTo(LongStream.rangeClosed(1, CALLERS).boxed().collect(Collectors.toSet()));
            assertThat(issuedDocumentNumberRepository.countByTenantId(tenantId)).isEqualTo(CALLERS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should keep sequences independent per tenant and per type")
    void shouldKeepSequencesIndependent() {
        String firstInvoice = as("clerk", () -> service.allocateDocumentNumber(DocumentType.INVOICE));
        String firstQuote = as("clerk", () -> service.allocateDocumentNumber(DocumentType.QUOTATION));
        String secondInvoice = as("clerk", () -> service.allocateDocumentNumber(DocumentType.INVOICE));

        String otherTenant = tenantId;
        tenantId = "tenant-other-" + otherTenant;
        String otherTenantInvoice = as("clerk", () -> service.allocateDocumentNumber(DocumentType.INVOICE));

        assertThat(firstInvoice).isEqualTo("INV-2026-0001");
        assertThat(firstQuote).isEqualTo("QUO-2026-0001");
        assertThat(secondInvoice).isEqualTo("INV-2026-0002");
        assertThat(otherTenantInvoice).isEqualTo("INV-2026-0001");
    }
}
