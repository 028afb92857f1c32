package com.docledger.document.exception;

import com.docledger.common.error.ErrorCode;
import com.docledger.common.error.ResourceNotFoundException;

import java.util.UUID;

public class DraftNotFoundException extends ResourceNotFoundException {

    private static final long serialVersionUID = 1L;

    public DraftNotFoundException(UUID documentId, String actorId) {
        super(ErrorCode.DOC_DRAFT_NOT_FOUND, "Draft", documentId + "/" + actorId);
        withMetadata("documentId", documentId);
        withMetadata("actorId", actorId);
    }
}
