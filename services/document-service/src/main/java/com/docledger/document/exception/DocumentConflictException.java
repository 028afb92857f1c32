package com.docledger.document.exception;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import com.docledger.document.domain.Conflict;
import lombok.Getter;

import java.util.List;
import java.util.UUID;

/**
 * Promotion rejected because the draft is based on an older version. The caller decides
 * whether to rebase and retry, re-merge or discard.
 */
@Getter
public class DocumentConflictException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final UUID documentId;
    private final transient Conflict conflict;

    public DocumentConflictException(UUID documentId, Conflict conflict) {
        super(ErrorCode.DOC_VERSION_CONFLICT,
            String.format("Draft for document %s is based on version %d but the document is at version %d",
                documentId, conflict.getDraftVersion(), conflict.getCurrentVersion()));
        this.documentId = documentId;
        this.conflict = conflict;
        withMetadata("documentId", documentId);
        withMetadata("draftVersion", conflict.getDraftVersion());
        withMetadata("currentVersion", conflict.getCurrentVersion());
        withMetadata("divergedFields", conflict.getDivergedFields());
    }

    public int getDraftVersion() {
        return conflict.getDraftVersion();
    }

    public int getCurrentVersion() {
        return conflict.getCurrentVersion();
    }

    public List<String> getDivergedFields() {
        return conflict.getDivergedFields();
    }
}
