package com.docledger.document.dto;

import com.docledger.document.domain.Document;
import com.docledger.document.domain.DocumentStatus;
import com.docledger.document.domain.DocumentType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.UUID;

@Value
@Builder
public class DocumentSummary {
    UUID id;
    DocumentType documentType;
    String documentNumber;
    String title;
    DocumentStatus status;
    int version;
    int completionPercentage;
    String ownerActorId;
    LocalDateTime updatedAt;
    LocalDateTime completedAt;

    public static DocumentSummary from(Document document) {
        return DocumentSummary.builder()
            .id(document.getId())
            .documentType(document.getDocumentType())
            .documentNumber(document.getDocumentNumber())
            .title(document.getTitle())
            .status(document.getStatus())
            .version(document.getVersion())
            .completionPercentage(document.getCompletionPercentage())
            .ownerActorId(document.getOwnerActorId())
            .updatedAt(document.getUpdatedAt())
            .completedAt(document.getCompletedAt())
            .build();
    }
}
