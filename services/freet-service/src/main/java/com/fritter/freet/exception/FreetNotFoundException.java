package com.fritter.freet.exception;

import com.fritter.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class FreetNotFoundException extends ResourceNotFoundException {

    public FreetNotFoundException(UUID freetId) {
        super("Freet", freetId);
    }
}
