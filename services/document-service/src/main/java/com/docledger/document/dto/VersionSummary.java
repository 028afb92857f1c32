package com.docledger.document.dto;

import com.docledger.document.domain.VersionRecord;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * History entry without the snapshot body.
 */
@Value
@Builder
public class VersionSummary {
    UUID documentId;
    int versionNumber;
    String changeSummary;
    List<String> changedFields;
    String actorId;
    LocalDateTime createdAt;

    public static VersionSummary from(VersionRecord record) {
        return VersionSummary.builder()
            .documentId(record.getDocumentId())
            .versionNumber(record.getVersionNumber())
            .changeSummary(record.getChangeSummary())
            .changedFields(List.copyOf(record.getChangedFields()))
            .actorId(record.getActorId())
            .createdAt(record.getCreatedAt())
            .build();
    }
}
