package com.docledger.document.exception;

import com.docledger.common.error.ErrorCode;
import com.docledger.common.error.ResourceNotFoundException;

import java.util.UUID;

public class DocumentNotFoundException extends ResourceNotFoundException {

    private static final long serialVersionUID = 1L;

    public DocumentNotFoundException(UUID documentId) {
        super(ErrorCode.DOC_NOT_FOUND, "Document", String.valueOf(documentId));
    }
}
