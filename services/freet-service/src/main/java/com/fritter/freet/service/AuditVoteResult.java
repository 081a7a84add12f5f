package com.fritter.freet.service;

import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Freet;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of an audit vote. {@code freet} is null when a failed audit removed it.
 */
@Value
public class AuditVoteResult {

    UUID freetId;
    AuditState auditState;
    Freet freet;
    boolean removed;

    public static AuditVoteResult retained(Freet freet) {
        return new AuditVoteResult(freet.getId(), freet.getAuditState(), freet, false);
    }

    public static AuditVoteResult removed(UUID freetId) {
        return new AuditVoteResult(freetId, AuditState.FAILED, null, true);
    }

    public boolean isResolved() {
        return auditState.isTerminal();
    }
}
