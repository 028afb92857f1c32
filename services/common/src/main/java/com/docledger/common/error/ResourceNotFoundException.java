package com.docledger.common.error;

import lombok.Getter;

/**
 * Exception thrown when a requested resource does not exist within the caller's tenant.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private static final long serialVersionUID = 1L;

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        this(ErrorCode.RESOURCE_NOT_FOUND, resourceType, resourceId);
    }

    /**
     * Constructor for subclasses that carry a more specific error code
     */
    protected ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found with ID: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        withMetadata("resourceType", resourceType);
        withMetadata("resourceId", resourceId);
    }
}
