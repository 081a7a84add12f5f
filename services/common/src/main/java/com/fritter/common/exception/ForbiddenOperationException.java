package com.fritter.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when the acting user is not allowed to perform an operation on a resource
 */
public class ForbiddenOperationException extends FritterException {

    public ForbiddenOperationException(String message) {
        super(message, "FORBIDDEN", HttpStatus.FORBIDDEN);
    }
}
