package com.touristtax.common.exception;

import lombok.Getter;

/**
 * A reservation, payment or other resource looked up by ID does not exist. Mapped to HTTP 404.
 */
@Getter
public class ResourceNotFoundException extends BusinessException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s %s not found", resourceType, resourceId), "RESOURCE_NOT_FOUND");
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
