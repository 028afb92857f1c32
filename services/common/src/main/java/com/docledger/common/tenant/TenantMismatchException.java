package com.docledger.common.tenant;

import com.docledger.common.error.BusinessException;
import com.docledger.common.error.ErrorCode;
import lombok.Getter;

/**
 * Raised when a caller touches a record owned by another tenant. Never retryable.
 */
@Getter
public class TenantMismatchException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final String callerTenantId;
    private final String resourceType;
    private final String resourceId;

    public TenantMismatchException(String callerTenantId, String resourceType, String resourceId) {
        super(ErrorCode.SEC_TENANT_MISMATCH,
            String.format("%s %s is not accessible from tenant %s", resourceType, resourceId, callerTenantId));
        this.callerTenantId = callerTenantId;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
