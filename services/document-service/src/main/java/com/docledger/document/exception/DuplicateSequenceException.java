package com.docledger.document.exception;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import com.docledger.document.domain.DocumentType;
import lombok.Getter;

/**
 * The allocator produced a number that was already issued. This is a defect in allocation,
 * not a business condition, and is never retried.
 */
@Getter
public class DuplicateSequenceException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final DocumentType documentType;
    private final String documentNumber;

    public DuplicateSequenceException(String tenantId, DocumentType documentType, String documentNumber, Throwable cause) {
        super(ErrorCode.SYS_SEQUENCE_DUPLICATE,
            String.format("Document number %s was already issued for tenant %s", documentNumber, tenantId),
            cause);
        this.tenantId = tenantId;
        this.documentType = documentType;
        this.documentNumber = documentNumber;
    }
}
