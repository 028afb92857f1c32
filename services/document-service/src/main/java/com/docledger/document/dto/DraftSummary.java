package com.docledger.document.dto;

import com.docledger.document.domain.Document;
import com.docledger.document.domain.Draft;
import com.docledger.document.domain.payload.SectionType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * One of the caller's open drafts, with enough of the document to label it in a list.
 */
@Value
@Builder
public class DraftSummary {
    UUID documentId;
    String documentNumber;
    String documentTitle;
    int baselineVersion;
    int documentVersion;
    boolean stale;
    List<SectionType> editedSections;
    LocalDateTime updatedAt;

    public static DraftSummary from(Draft draft, Document document) {
        return DraftSummary.builder()
            .documentId(draft.getDocumentId())
            .documentNumber(document.getDocumentNumber())
            .documentTitle(document.getTitle())
            .baselineVersion(draft.getBaselineVersion())
            .documentVersion(document.getVersion())
            .stale(draft.isStale(document.getVersion()))
            .editedSections(draft.getPayloadDelta().getPresentSections())
            .updatedAt(draft.getUpdatedAt())
            .build();
    }
}
