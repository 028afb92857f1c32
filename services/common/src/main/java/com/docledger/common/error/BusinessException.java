package com.docledger.common.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.HashMap;
import java.util.Map;

/**
 * Base exception for business errors raised by the DocLedger services.
 *
 * Carries an error code, the HTTP-equivalent status the API layer should answer with,
 * structured metadata for the caller and whether the operation may be retried as-is.
 */
@Getter
public class BusinessException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String errorCode;
    private final int statusCode;
    private final Map<String, Object> metadata;
    private final boolean retryable;

    /**
     * Constructor with error code, message, and status code
     */
    public BusinessException(String errorCode, String message, int statusCode) {
        super(message);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.metadata = new HashMap<>();
        this.retryable = false;
    }

    /**
     * Constructor from ErrorCode enum
     */
    public BusinessException(ErrorCode errorCode, String message) {
        super(message != null ? message : errorCode.getDefaultMessage());
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getStatusCode();
        this.metadata = new HashMap<>();
        this.retryable = errorCode.isRetryable();
    }

    /**
     * Constructor from ErrorCode enum with cause
     */
    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(message != null ? message : errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode.getCode();
        this.statusCode = errorCode.getStatusCode();
        this.metadata = new HashMap<>();
        this.retryable = errorCode.isRetryable();
    }

    /**
     * Add metadata to the exception
     */
    public BusinessException withMetadata(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    /**
     * Create exception for a rejected argument
     */
    public static BusinessException invalidArgument(String message) {
        return new BusinessException(ErrorCode.VAL_INVALID_ARGUMENT, message);
    }

    public HttpStatus getHttpStatus() {
        return HttpStatus.valueOf(statusCode);
    }

    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    @Override
    public String toString() {
        return String.format("%s[errorCode=%s, statusCode=%d, message=%s, retryable=%s]",
            getClass().getSimpleName(), errorCode, statusCode, getMessage(), retryable);
    }
}
