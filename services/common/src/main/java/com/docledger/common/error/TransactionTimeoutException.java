package com.docledger.common.error;

import lombok.Getter;

/**
 * Exception thrown when a row lock or transaction could not complete within its time budget.
 *
 * Nothing was committed; callers may retry with backoff.
 */
@Getter
public class TransactionTimeoutException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;
    private final int waitTimeSeconds;

    public TransactionTimeoutException(String resourceName, int waitTimeSeconds, Throwable cause) {
        super(ErrorCode.SYS_LOCK_TIMEOUT,
            String.format("Failed to acquire lock on '%s' within %d seconds", resourceName, waitTimeSeconds),
            cause);
        this.resourceName = resourceName;
        this.waitTimeSeconds = waitTimeSeconds;
        withMetadata("resource", resourceName);
        withMetadata("waitTimeSeconds", waitTimeSeconds);
    }
}
