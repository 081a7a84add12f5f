package com.fritter.freet.exception;

import com.fritter.common.exception.ForbiddenOperationException;

import java.util.UUID;

public class FreetModificationForbiddenException extends ForbiddenOperationException {

    public FreetModificationForbiddenException(UUID freetId, UUID userId) {
        super(String.format("User %s is not the author of freet %s", userId, freetId));
        withMetadata("freetId", freetId);
    }
}
