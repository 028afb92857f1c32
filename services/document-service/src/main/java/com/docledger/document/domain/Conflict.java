package com.docledger.document.domain;

import lombok.Value;

import java.util.List;

/**
 * A draft built on {@code draftVersion} while the document has moved on to {@code currentVersion}.
 * {@code divergedFields} lists the payload paths that changed between those two versions.
 */
@Value
public class Conflict {
    int draftVersion;
    int currentVersion;
    List<String> divergedFields;

    public Conflict(int draftVersion, int currentVersion, List<String> divergedFields) {
        this.draftVersion = draftVersion;
        this.currentVersion = currentVersion;
        this.divergedFields = divergedFields != null ? List.copyOf(divergedFields) : List.of();
    }
}
