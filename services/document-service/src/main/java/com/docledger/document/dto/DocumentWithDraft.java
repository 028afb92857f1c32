package com.docledger.document.dto;

import com.docledger.document.domain.Conflict;
import com.docledger.document.domain.Document;
import com.docledger.document.domain.Draft;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * A document as the calling actor sees it: the committed state, their own draft if any, and
 * the conflict that promoting that draft would currently run into.
 */
@Value
@Builder
public class DocumentWithDraft {
    Document document;
    Draft draft;
    Conflict conflict;

    public Optional<Draft> getDraft() {
        return Optional.ofNullable(draft);
    }

    public Optional<Conflict> getConflict() {
        return Optional.ofNullable(conflict);
    }

    public boolean hasConflict() {
        return conflict != null;
    }
}
