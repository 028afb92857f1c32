package com.docledger.document.service;

import com.docledger.document.domain.payload.BusinessContext;
import com.docledger.document.domain.payload.ContactInfo;
import com.docledger.document.domain.payload.DocumentPayload;
import com.docledger.document.support.TestPayloads;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the structural payload diff used in version records and conflict reports.
 */
@DisplayName("PayloadDiffer Tests")
class PayloadDifferTest {

    private final PayloadDiffer differ = new PayloadDiffer(new ObjectMapper());

    @Test
    @DisplayName("Should report nothing for equal payloads")
    void shouldReportNothingForEqualPayloads() {
        assertThat(differ.diff(TestPayloads.completeConsultation("Acme"), TestPayloads.completeConsultation("Acme")))
            .isEmpty();
    }

    @Test
    @DisplayName("Should report changed leaves as dotted paths")
    void shouldReportDottedLeafPaths() {
        // Arrange
        DocumentPayload before = TestPayloads.partialConsultation("Acme");
        DocumentPayload after = before.mergeWith(DocumentPayload.builder()
            .contactInfo(before.getContactInfo().toBuilder().businessName("Acme Corp").phone("+1 555 0100").build())
            .build());

        // Act
        List<String> changed = differ.diff(before, after);

        // Assert
        assertThat(changed).containsExactly("contactInfo.businessName", "contactInfo.phone");
    }

    @Test
    @DisplayName("Should list every leaf of an added section in sorted order")
    void shouldListAddedSectionLeaves() {
        DocumentPayload before = TestPayloads.withContact("Acme");
        DocumentPayload after = before.mergeWith(DocumentPayload.builder()
            .businessContext(BusinessContext.builder().industry("Retail").teamSize(4).build())
            .notes("first call")
            .build());

        assertThat(differ.diff(before, after))
            .containsExactly("businessContext.industry", "businessContext.teamSize", "notes");
    }

    @Test
    @DisplayName("Should compare arrays as whole values")
    void shouldCompareArraysWhole() {
        DocumentPayload before = DocumentPayload.builder().painPoints(TestPayloads.painPoints("a", "b")).build();
        DocumentPayload after = DocumentPayload.builder().painPoints(TestPayloads.painPoints("a", "c")).build();

        assertThat(differ.diff(before, after)).containsExactly("painPoints.primaryChallenges");
    }

    @Test
    @DisplayName("Should descend into map-valued fields")
    void shouldDescendIntoMaps() {
        DocumentPayload before = DocumentPayload.builder()
            .contactInfo(ContactInfo.builder().businessName("Acme").socialMedia(Map.of("x", "@acme")).build())
            .build();
        DocumentPayload after = DocumentPayload.builder()
            .contactInfo(ContactInfo.builder().businessName("Acme")
                .socialMedia(Map.of("x", "@acme", "linkedin", "acme-inc")).build())
            .build();

        assertThat(differ.diff(before, after)).containsExactly("contactInfo.socialMedia.linkedin");
    }

    @Test
    @DisplayName("Should treat null inputs and null values as absent")
    void shouldTreatNullAsAbsent() {
        DocumentPayload withNullField = DocumentPayload.builder()
            .contactInfo(ContactInfo.builder().businessName("Acme").build())
            .build();
        DocumentPayload withoutField = TestPayloads.withContact("Acme").toBuilder()
            .contactInfo(ContactInfo.builder().businessName("Acme").build())
            .build();

        assertThat(differ.diff(withNullField, withoutField)).isEmpty();
        assertThat(differ.diff(null, DocumentPayload.empty())).isEmpty();
        assertThat(differ.diff(null, TestPayloads.withContact("Acme"))).contains("contactInfo.businessName");
    }
}
