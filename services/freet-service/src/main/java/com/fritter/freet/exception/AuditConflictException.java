package com.fritter.freet.exception;

import com.fritter.common.exception.InvalidResourceStateException;
import com.fritter.freet.domain.AuditState;

import java.util.UUID;

/**
 * Raised when a report or audit vote does not fit the freet's audit state.
 */
public class AuditConflictException extends InvalidResourceStateException {

    public AuditConflictException(UUID freetId, AuditState currentState, AuditState requiredState) {
        super("Freet " + freetId + " audit", currentState.name(), requiredState.name());
        withMetadata("freetId", freetId);
    }
}
