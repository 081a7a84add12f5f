package com.fritter.common.exception;

import org.springframework.http.HttpStatus;

import java.util.UUID;

/**
 * Exception thrown when a referenced resource does not exist
 */
public class ResourceNotFoundException extends FritterException {
    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String message) {
        super(message, "NOT_FOUND", HttpStatus.NOT_FOUND);
        this.resourceType = null;
        this.resourceId = null;
    }

    public ResourceNotFoundException(String resourceName, String fieldName, Object fieldValue) {
        super(String.format("%s not found with %s: %s", resourceName, fieldName, fieldValue),
            "NOT_FOUND", HttpStatus.NOT_FOUND);
        this.resourceType = resourceName;
        this.resourceId = fieldValue != null ? fieldValue.toString() : null;
    }

    public ResourceNotFoundException(String resourceName, UUID id) {
        super(String.format("%s not found with ID: %s", resourceName, id), "NOT_FOUND", HttpStatus.NOT_FOUND);
        this.resourceType = resourceName;
        this.resourceId = id != null ? id.toString() : null;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
