package com.docledger.document.domain.payload;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One typed section of a {@link DocumentPayload}.
 */
public interface PayloadSection {

    @JsonIgnore
    SectionType sectionType();
}
