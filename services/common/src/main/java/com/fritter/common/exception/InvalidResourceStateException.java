package com.fritter.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when an operation is attempted on a resource that is in an invalid state
 */
public class InvalidResourceStateException extends FritterException {
    private final String resourceType;
    private final String currentState;
    private final String expectedState;

    public InvalidResourceStateException(String message) {
        super(message, "INVALID_STATE", HttpStatus.CONFLICT);
        this.resourceType = null;
        this.currentState = null;
        this.expectedState = null;
    }

    public InvalidResourceStateException(String resourceName, String currentState, String requiredState) {
        super(String.format("%s is in invalid state: %s. Required state: %s",
                resourceName, currentState, requiredState), "INVALID_STATE", HttpStatus.CONFLICT);
        this.resourceType = resourceName;
        this.currentState = currentState;
        this.expectedState = requiredState;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getExpectedState() {
        return expectedState;
    }
}
