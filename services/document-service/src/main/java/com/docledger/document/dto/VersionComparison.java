package com.docledger.document.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class VersionComparison {
    UUID documentId;
    int fromVersion;
    int toVersion;
    List<String> changedFields;

    public boolean isIdentical() {
        return changedFields.isEmpty();
    }
}
