package com.docledger.document.exception;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import com.docledger.document.domain.DocumentStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * The requested operation is not permitted by the document status policy.
 */
@Getter
public class InvalidStatusTransitionException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final DocumentStatus currentStatus;
    private final DocumentStatus targetStatus;

    private InvalidStatusTransitionException(ErrorCode errorCode, String message,
                                             DocumentStatus currentStatus, DocumentStatus targetStatus) {
        super(errorCode, message);
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
        withMetadata("currentStatus", currentStatus != null ? currentStatus.getValue() : null);
        withMetadata("targetStatus", targetStatus != null ? targetStatus.getValue() : null);
    }

    public static InvalidStatusTransitionException transition(UUID documentId, DocumentStatus from, DocumentStatus to) {
        return new InvalidStatusTransitionException(ErrorCode.DOC_STATUS_TRANSITION_INVALID,
            String.format("Document %s cannot transition from %s to %s", documentId, from.getValue(),
                to != null ? to.getValue() : "null"),
            from, to);
    }

    public static InvalidStatusTransitionException notEditable(UUID documentId, DocumentStatus status, String operation) {
        return new InvalidStatusTransitionException(ErrorCode.DOC_NOT_EDITABLE,
            String.format("Cannot %s document %s while it is %s", operation, documentId, status.getValue()),
            status, null);
    }
}
