package com.docledger.document.domain.payload;

import java.util.Arrays;

/**
 * The structured sections a document payload can carry. {@code fieldName} is the JSON property
 * name, which is also the root of the dotted paths reported by diffs and validation.
 */
public enum SectionType {
    CONTACT_INFO("contactInfo"),
    BUSINESS_CONTEXT("businessContext"),
    PAIN_POINTS("painPoints"),
    GOALS_OBJECTIVES("goalsObjectives");

    private final String fieldName;

    SectionType(String fieldName) {
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public static SectionType fromFieldName(String fieldName) {
        return Arrays.stream(values())
            .filter(type -> type.fieldName.equals(fieldName))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown payload section: " + fieldName));
    }
}
