package com.docledger.common.error;

import org.springframework.http.HttpStatus;

/**
 * Error codes shared by the DocLedger services.
 *
 * Format: MODULE_NNNN
 * Categories:
 * - 5xxx: System & Infrastructure
 * - 7xxx: Validation & Data
 * - 8xxx: Security & Tenancy
 * - 9xxx: Documents, Versions & Sequences
 */
public enum ErrorCode {

    // ===== 5xxx: SYSTEM & INFRASTRUCTURE =====
    SYS_INTERNAL_ERROR("SYS_5001", "Internal server error", HttpStatus.INTERNAL_SERVER_ERROR),
    SYS_LOCK_TIMEOUT("SYS_5002", "Could not acquire the resource lock in time", HttpStatus.SERVICE_UNAVAILABLE),
    SYS_SEQUENCE_DUPLICATE("SYS_5003", "Allocated sequence number is already in use", HttpStatus.INTERNAL_SERVER_ERROR),

    // ===== 7xxx: VALIDATION & DATA =====
    VALIDATION_FAILED("VAL_7001", "Validation failed", HttpStatus.BAD_REQUEST),
    VAL_INVALID_ARGUMENT("VAL_7002", "Invalid argument", HttpStatus.BAD_REQUEST),

    // ===== 8xxx: SECURITY & TENANCY =====
    SEC_TENANT_MISMATCH("SEC_8001", "Access across tenant boundary rejected", HttpStatus.FORBIDDEN),
    SEC_TENANT_CONTEXT_MISSING("SEC_8002", "No tenant context bound to the current call", HttpStatus.UNAUTHORIZED),

    // ===== 9xxx: DOCUMENTS, VERSIONS & SEQUENCES =====
    RESOURCE_NOT_FOUND("RESOURCE_9201", "Resource not found", HttpStatus.NOT_FOUND),
    DOC_NOT_FOUND("DOC_9301", "Document not found", HttpStatus.NOT_FOUND),
    DOC_DRAFT_NOT_FOUND("DOC_9302", "Draft not found", HttpStatus.NOT_FOUND),
    DOC_VERSION_NOT_FOUND("DOC_9303", "Document version not found", HttpStatus.NOT_FOUND),
    DOC_VERSION_CONFLICT("DOC_9304", "Draft is based on an outdated document version", HttpStatus.CONFLICT),
    DOC_STATUS_TRANSITION_INVALID("DOC_9305", "Document status transition not allowed", HttpStatus.UNPROCESSABLE_ENTITY),
    DOC_NOT_EDITABLE("DOC_9306", "Document cannot be edited in its current status", HttpStatus.UNPROCESSABLE_ENTITY);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus httpStatus;

    ErrorCode(String code, String defaultMessage, HttpStatus httpStatus) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public int getStatusCode() {
        return httpStatus.value();
    }

    /**
     * Get error category from code prefix
     */
    public String getCategory() {
        if (code.startsWith("SYS_")) return "SYSTEM";
        if (code.startsWith("VAL_")) return "VALIDATION";
        if (code.startsWith("SEC_")) return "SECURITY";
        if (code.startsWith("DOC_")) return "DOCUMENT";
        if (code.startsWith("RESOURCE_")) return "RESOURCE";
        return "GENERAL";
    }

    /**
     * Check if this error should be retried
     */
    public boolean isRetryable() {
        return httpStatus == HttpStatus.SERVICE_UNAVAILABLE ||
               httpStatus == HttpStatus.GATEWAY_TIMEOUT;
    }

    /**
     * Find error code by code string
     */
    public static ErrorCode fromCode(String code) {
        if (code == null) {
            return SYS_INTERNAL_ERROR;
        }
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return SYS_INTERNAL_ERROR;
    }
}
