package com.example.guard.common.exception;

import lombok.Getter;

/**
 * Raised by the admin API when an incident, policy, rule or pattern does not exist.
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
