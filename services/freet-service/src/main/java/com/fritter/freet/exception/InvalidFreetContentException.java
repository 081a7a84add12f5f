package com.fritter.freet.exception;

import com.fritter.common.exception.InvalidArgumentException;

public class InvalidFreetContentException extends InvalidArgumentException {

    public InvalidFreetContentException(String message) {
        super("content", message);
    }
}
