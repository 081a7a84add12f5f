package com.fritter.freet.exception;

import com.fritter.common.exception.ResourceNotFoundException;

import java.util.UUID;

public class UserNotFoundException extends ResourceNotFoundException {

    public UserNotFoundException(UUID userId) {
        super("User", userId);
    }

    public UserNotFoundException(String username) {
        super("User", "username", username);
    }
}
