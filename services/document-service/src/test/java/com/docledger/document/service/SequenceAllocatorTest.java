package com.docledger.document.service;

import com.docledger.document.config.DocumentProperties;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.IssuedDocumentNumber;
import com.docledger.document.exception.DuplicateSequenceException;
import com.docledger.document.metrics.DocumentMetrics;
import com.docledger.document.store.DocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SequenceAllocator
 *
 * Covers number formatting, in-transaction counter bootstrap, counter provisioning
 * and the duplicate-number guard.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("SequenceAllocator Unit Tests")
class SequenceAllocatorTest {

    private static final String TENANT = "tenant-1";

    @Mock
    private DocumentStore documentStore;

    @Mock
    private DocumentMetrics metrics;

    private DocumentProperties properties;
    private SequenceAllocator allocator;

    @BeforeEach
    void setUp() {
        properties = new DocumentProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-07-14T10:15:00Z"), ZoneOffset.UTC);
        allocator = new SequenceAllocator(documentStore, properties, metrics, clock);
    }

    @Nested
    @DisplayName("Formatting")
    class FormattingTests {

        @Test
        @DisplayName("Should pad the sequence to four digits and keep longer values intact")
        void shouldFormatNumbers() {
            assertThat(SequenceAllocator.formatNumber("CNS", 2026, 7)).isEqualTo("CNS-2026-0007");
            assertThat(SequenceAllocator.formatNumber("INV", 2026, 12345)).isEqualTo("INV-2026-12345");
        }

        @Test
        @DisplayName("Should parse the sequence back out of a number")
        void shouldParseSequence() {
            assertThat(SequenceAllocator.parseSequence("CNS-2026-0042")).isEqualTo(42L);
            assertThat(SequenceAllocator.parseSequence("PROP-2025-10001")).isEqualTo(10001L);
        }

        @ParameterizedTest
        @ValueSource(strings = {"CNS-26-0001", "cns-2026-0001", "CNS-2026-01", "garbage"})
        @DisplayName("Should reject strings that are not document numbers")
        void shouldRejectMalformedNumbers(String value) {
            assertThatThrownBy(() -> SequenceAllocator.parseSequence(value))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Allocation")
    class AllocationTests {

        @Test
        @DisplayName("Should format the allocated value with prefix and clock year and register it")
        void shouldAllocateAndRegisterNumber() {
            // Arrange
            when(documentStore.incrementCounter(TENANT, DocumentType.CONSULTATION)).thenReturn(OptionalLong.of(42));

            // Act
            String number = allocator.allocateDocumentNumber(TENANT, DocumentType.CONSULTATION);

            // Assert
            assertThat(number).isEqualTo("CNS-2026-0042");
            ArgumentCaptor<IssuedDocumentNumber> issued = ArgumentCaptor.forClass(IssuedDocumentNumber.class);
            verify(documentStore).recordIssuedNumber(issued.capture());
            assertThat(issued.getValue().getDocumentNumber()).isEqualTo("CNS-2026-0042");
            assertThat(issued.getValue().getSequenceValue()).isEqualTo(42L);
            verify(metrics).sequenceAllocated(DocumentType.CONSULTATION);
        }

        @Test
        @DisplayName("Should use a configured prefix over the type default")
        void shouldUseConfiguredPrefix() {
            properties.getNumbering().getPrefixes().put(DocumentType.INVOICE, "BILL");
            when(documentStore.incrementCounter(TENANT, DocumentType.INVOICE)).thenReturn(OptionalLong.of(1));

            assertThat(allocator.allocateDocumentNumber(TENANT, DocumentType.INVOICE)).isEqualTo("BILL-2026-0001");
        }

        @Test
        @DisplayName("Should create a missing counter in-transaction and retry the increment once")
        void shouldBootstrapMissingCounter() {
            when(documentStore.incrementCounter(TENANT, DocumentType.PROPOSAL))
                .thenReturn(OptionalLong.empty())
                .thenReturn(OptionalLong.of(1));

            long value = allocator.allocate(TENANT, DocumentType.PROPOSAL);

            assertThat(value).isEqualTo(1L);
            InOrder inOrder = inOrder(documentStore);
            inOrder.verify(documentStore).incrementCounter(TENANT, DocumentType.PROPOSAL);
            inOrder.verify(documentStore).insertCounterIfAbsent(TENANT, DocumentType.PROPOSAL);
            inOrder.verify(documentStore).incrementCounter(TENANT, DocumentType.PROPOSAL);
        }

        @Test
        @DisplayName("Should fail when the counter still cannot be incremented")
        void shouldFailWhenCounterMissing() {
            when(documentStore.incrementCounter(TENANT, DocumentType.PROPOSAL)).thenReturn(OptionalLong.empty());

            assertThatThrownBy(() -> allocator.allocate(TENANT, DocumentType.PROPOSAL))
                .isInstanceOf(IllegalStateException.class);
            verify(metrics, never()).sequenceAllocated(any());
        }

        @Test
        @DisplayName("Should raise a duplicate-sequence failure when the number was already issued")
        void shouldRaiseOnDuplicateNumber() {
            when(documentStore.incrementCounter(TENANT, DocumentType.CONSULTATION)).thenReturn(OptionalLong.of(7));
            when(documentStore.recordIssuedNumber(any())).thenThrow(new DataIntegrityViolationException("uk_document_numbers"));

            assertThatThrownBy(() -> allocator.allocateDocumentNumber(TENANT, DocumentType.CONSULTATION))
                .isInstanceOfSatisfying(DuplicateSequenceException.class, e -> {
                    assertThat(e.getDocumentNumber()).isEqualTo("CNS-2026-0007");
                    assertThat(e.isRetryable()).isFalse();
                });
            verify(metrics).sequenceDuplicate(DocumentType.CONSULTATION);
        }
    }

    @Nested
    @DisplayName("Provisioning")
    class ProvisioningTests {

        @Test
        @DisplayName("Should do nothing when the counter exists")
        void shouldSkipExistingCounter() {
            when(documentStore.counterExists(TENANT, DocumentType.QUOTATION)).thenReturn(true);

            allocator.provisionCounter(TENANT, DocumentType.QUOTATION);

            verify(documentStore, never()).createCounter(anyString(), any());
        }

        @Test
        @DisplayName("Should re-check after losing a concurrent create")
        void shouldRecheckAfterLosingRace() {
            when(documentStore.counterExists(TENANT, DocumentType.QUOTATION)).thenReturn(false, true);
            doThrow(new DataIntegrityViolationException("duplicate key"))
                .when(documentStore).createCounter(TENANT, DocumentType.QUOTATION);

            allocator.provisionCounter(TENANT, DocumentType.QUOTATION);

            verify(documentStore, times(1)).createCounter(TENANT, DocumentType.QUOTATION);
            verify(documentStore, times(2)).counterExists(TENANT, DocumentType.QUOTATION);
        }

        @Test
        @DisplayName("Should give up quietly after the configured attempts")
        void shouldGiveUpAfterAttempts() {
            properties.getNumbering().setProvisionAttempts(2);
            when(documentStore.counterExists(TENANT, DocumentType.QUOTATION)).thenReturn(false);
            doThrow(new DataIntegrityViolationException("duplicate key"))
                .when(documentStore).createCounter(TENANT, DocumentType.QUOTATION);

            assertThatCode(() -> allocator.provisionCounter(TENANT, DocumentType.QUOTATION)).doesNotThrowAnyException();
            verify(documentStore, times(2)).createCounter(TENANT, DocumentType.QUOTATION);
        }
    }
}
