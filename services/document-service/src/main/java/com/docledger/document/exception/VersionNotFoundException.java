package com.docledger.document.exception;

import com.docledger.common.error.ErrorCode;
import com.docledger.common.error.ResourceNotFoundException;

import java.util.UUID;

public class VersionNotFoundException extends ResourceNotFoundException {

    private static final long serialVersionUID = 1L;

    public VersionNotFoundException(UUID documentId, int versionNumber) {
        super(ErrorCode.DOC_VERSION_NOT_FOUND, "DocumentVersion", documentId + "@" + versionNumber);
        withMetadata("documentId", documentId);
        withMetadata("versionNumber", versionNumber);
    }
}
