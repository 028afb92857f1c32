package com.docledger.document.domain;

import com.docledger.document.domain.payload.SectionType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of versioned business records. Each type has its own number sequence per tenant,
 * a default number prefix and the sections that must be filled in before completion.
 */
public enum DocumentType {
    CONSULTATION("CNS", EnumSet.allOf(SectionType.class)),
    PROPOSAL("PROP", EnumSet.of(SectionType.CONTACT_INFO)),
    CONTRACT("CON", EnumSet.of(SectionType.CONTACT_INFO)),
    INVOICE("INV", EnumSet.of(SectionType.CONTACT_INFO)),
    QUOTATION("QUO", EnumSet.of(SectionType.CONTACT_INFO));

    private final String defaultPrefix;
    private final Set<SectionType> requiredForCompletion;

    DocumentType(String defaultPrefix, Set<SectionType> requiredForCompletion) {
        this.defaultPrefix = defaultPrefix;
        this.requiredForCompletion = requiredForCompletion;
    }

    public String getDefaultPrefix() {
        return defaultPrefix;
    }

    public Set<SectionType> getRequiredForCompletion() {
        return EnumSet.copyOf(requiredForCompletion);
    }
}
