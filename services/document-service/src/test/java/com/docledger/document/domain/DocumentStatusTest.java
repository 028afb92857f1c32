package com.docledger.document.domain;

import com.docledger.common.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DocumentStatus Tests")
class DocumentStatusTest {

    @ParameterizedTest
    @CsvSource({
        "DRAFT, COMPLETED, true",
        "DRAFT, ARCHIVED, false",
        "COMPLETED, ARCHIVED, true",
        "COMPLETED, DRAFT, false",
        "ARCHIVED, COMPLETED, true",
        "ARCHIVED, DRAFT, true",
        "ARCHIVED, ARCHIVED, false"
    })
    @DisplayName("Should permit only the documented transitions")
    void shouldEnforceTransitions(DocumentStatus from, DocumentStatus to, boolean allowed) {
        assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
    }

    @Test
    @DisplayName("Should treat archived documents as read-only")
    void shouldTreatArchivedAsReadOnly() {
        assertThat(DocumentStatus.DRAFT.isEditable()).isTrue();
        assertThat(DocumentStatus.COMPLETED.isEditable()).isTrue();
        assertThat(DocumentStatus.ARCHIVED.isEditable()).isFalse();
    }

    @Test
    @DisplayName("Should parse values case-insensitively")
    void shouldParseValues() {
        assertThat(DocumentStatus.fromValue("completed")).isEqualTo(DocumentStatus.COMPLETED);
        assertThat(DocumentStatus.fromValue(" Archived ")).isEqualTo(DocumentStatus.ARCHIVED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"converted", "deleted", ""})
    @DisplayName("Should reject unknown status values")
    void shouldRejectUnknownValues(String value) {
        assertThatThrownBy(() -> DocumentStatus.fromValue(value))
            .isInstanceOfSatisfying(ValidationException.class, e ->
                assertThat(e.hasFieldError("status")).isTrue());
    }
}
