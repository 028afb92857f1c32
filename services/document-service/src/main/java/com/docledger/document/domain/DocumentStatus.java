package com.docledger.document.domain;

import com.docledger.common.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a document. Only these three values exist; anything else
 * (for example "converted") is rejected as invalid input.
 */
public enum DocumentStatus {
    DRAFT("draft"),
    COMPLETED("completed"),
    ARCHIVED("archived");

    private final String value;

    DocumentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Status transitions permitted from this status. Restoring an archived document to draft
     * is only allowed when the caller asks for it explicitly.
     */
    public Set<DocumentStatus> allowedTargets() {
        switch (this) {
            case DRAFT:
                return EnumSet.of(COMPLETED);
            case COMPLETED:
                return EnumSet.of(ARCHIVED);
            case ARCHIVED:
                return EnumSet.of(COMPLETED, DRAFT);
            default:
                return EnumSet.noneOf(DocumentStatus.class);
        }
    }

    public boolean canTransitionTo(DocumentStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    /**
     * Drafts can be saved and promoted against draft and completed documents.
     */
    public boolean isEditable() {
        return this != ARCHIVED;
    }

    @JsonCreator
    public static DocumentStatus fromValue(String value) {
        if (value == null) {
            throw new ValidationException("status", "status is required");
        }
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new ValidationException("status",
                "unknown document status '" + value + "', expected one of draft, completed, archived"));
    }
}
