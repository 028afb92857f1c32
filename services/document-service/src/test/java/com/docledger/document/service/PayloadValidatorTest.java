package com.docledger.document.service;

import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import com.docledger.document.domain.payload.ContactInfo;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.domain.payload.PainPoints;
import com.docledger.document.exception.DocumentValidationException;
import com.docledger.document.support.TestPayloads;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PayloadValidator against a real Bean Validation provider.
 */
@DisplayName("PayloadValidator Tests")
class PayloadValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static PayloadValidator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = new PayloadValidator(validatorFactory.getValidator());
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Nested
    @DisplayName("Well-formedness")
    class WellFormedTests {

        @Test
        @DisplayName("Should accept partial payloads")
        void shouldAcceptPartialPayload() {
            assertThatCode(() -> validator.validateWellFormed(TestPayloads.withContact("Acme")))
                .doesNotThrowAnyException();
            assertThatCode(() -> validator.validateWellFormed(DocumentPayload.empty()))
                .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should key errors by dotted field path")
        void shouldRejectMalformedFields() {
            DocumentPayload payload = DocumentPayload.builder()
                .contactInfo(ContactInfo.builder().businessName("Acme").email("not-an-email").website("ftp://acme").build())
                .build();

            assertThatThrownBy(() -> validator.validateWellFormed(payload))
                .isInstanceOfSatisfying(DocumentValidationException.class, e ->
                    assertThat(e.getFieldErrors()).containsKeys("contactInfo.email", "contactInfo.website"));
        }

        @Test
        @DisplayName("Should not apply completion rules to drafts")
        void shouldIgnoreCompletionRules() {
            DocumentPayload payload = DocumentPayload.builder()
                .painPoints(PainPoints.builder().primaryChallenges(List.of()).build())
                .build();

            assertThatCode(() -> validator.validateFor(DocumentStatus.DRAFT, DocumentType.CONSULTATION, payload))
                .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Completion")
    class CompletionTests {

        @Test
        @DisplayName("Should accept a fully populated consultation")
        void shouldAcceptCompleteConsultation() {
            assertThatCode(() -> validator.validateForCompletion(DocumentType.CONSULTATION,
                TestPayloads.completeConsultation("Acme"))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Should name every missing required section")
        void shouldNameMissingSections() {
            assertThatThrownBy(() -> validator.validateForCompletion(DocumentType.CONSULTATION,
                TestPayloads.partialConsultation("Acme")))
                .isInstanceOfSatisfying(DocumentValidationException.class, e -> {
                    assertThat(e.getFieldErrors()).containsOnlyKeys("painPoints", "goalsObjectives");
                    assertThat(e.getFieldErrors().get("painPoints")).containsExactly("section is required for completion");
                });
        }

        @Test
        @DisplayName("Should apply completion rules inside present sections")
        void shouldCheckSectionContents() {
            DocumentPayload payload = TestPayloads.completeConsultation("Acme").toBuilder()
                .contactInfo(ContactInfo.builder().businessName(" ").build())
                .painPoints(PainPoints.builder().primaryChallenges(List.of("slow quotes")).build())
                .build();

            assertThatThrownBy(() -> validator.validateForCompletion(DocumentType.CONSULTATION, payload))
                .isInstanceOfSatisfying(DocumentValidationException.class, e ->
                    assertThat(e.getFieldErrors()).containsOnlyKeys("contactInfo.businessName", "painPoints.urgencyLevel"));
        }

        @Test
        @DisplayName("Should only require contact info for non-consultation types")
        void shouldRequireContactOnlyForOtherTypes() {
            assertThatCode(() -> validator.validateForCompletion(DocumentType.INVOICE, TestPayloads.withContact("Acme")))
                .doesNotThrowAnyException();
            assertThatThrownBy(() -> validator.validateForCompletion(DocumentType.INVOICE, DocumentPayload.empty()))
                .isInstanceOfSatisfying(DocumentValidationException.class, e ->
                    assertThat(e.getFieldErrors()).containsOnlyKeys("contactInfo"));
        }
    }
}
