package com.fritter.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Exception thrown when caller-supplied input is malformed or outside its allowed values
 */
@Getter
public class InvalidArgumentException extends FritterException {

    private final String field;

    public InvalidArgumentException(String message) {
        super(message, "INVALID_ARGUMENT", HttpStatus.BAD_REQUEST);
        this.field = null;
    }

    public InvalidArgumentException(String field, String message) {
        super(message, "INVALID_ARGUMENT", HttpStatus.BAD_REQUEST);
        this.field = field;
    }
}
