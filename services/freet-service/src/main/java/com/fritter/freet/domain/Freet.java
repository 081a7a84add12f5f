package com.fritter.freet.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "freets", indexes = {
        @Index(name = "idx_freets_author", columnList = "author_id"),
        @Index(name = "idx_freets_modified_at", columnList = "modified_at"),
        @Index(name = "idx_freets_audit_state", columnList = "audit_state")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Freet {

    public static final int MAX_CONTENT_LENGTH = 140;

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "author_id", nullable = false)
    private UUID authorId;

    @Column(name = "content", nullable = false, length = MAX_CONTENT_LENGTH)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "modified_at", nullable = false)
    private Instant modifiedAt;

    @Column(name = "upvotes", nullable = false)
    @Builder.Default
    private int upvotes = 0;

    @Column(name = "downvotes", nullable = false)
    @Builder.Default
    private int downvotes = 0;

    @Embedded
    @Builder.Default
    private ReportTally reportTally = ReportTally.empty();

    @Column(name = "flagged", nullable = false)
    @Builder.Default
    private boolean flagged = false;

    @Column(name = "cover", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private Cover cover = Cover.NONE;

    @Column(name = "audit_state", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private AuditState auditState = AuditState.NONE;

    @Column(name = "audit_category", length = 20)
    @Enumerated(EnumType.STRING)
    private ReportCategory auditCategory;

    @Embedded
    private AuditTally auditTally;

    @Version
    private Long version;

    public int netScore() {
        return upvotes - downvotes;
    }

    public void adjustVotes(int upvoteDelta, int downvoteDelta) {
        int newUpvotes = upvotes + upvoteDelta;
        int newDownvotes = downvotes + downvoteDelta;
        if (newUpvotes < 0 || newDownvotes < 0) {
            throw new IllegalStateException(String.format(
                "Vote tally of freet %s would become negative (%d, %d)", id, newUpvotes, newDownvotes));
        }
        upvotes = newUpvotes;
        downvotes = newDownvotes;
    }

    /**
     * Recompute the flag and, unless an audit owns the cover, the vote-derived cover.
     * A tie keeps the current cover.
     */
    public void refreshVoteDerivedState() {
        flagged = downvotes > upvotes;
        if (isCoverHeldByAudit()) {
            return;
        }
        if (downvotes > upvotes) {
            cover = Cover.CONTROVERSIAL;
        } else if (upvotes > downvotes) {
            cover = Cover.NONE;
        }
    }

    public boolean isCoverHeldByAudit() {
        return auditState == AuditState.TESTING || cover == Cover.TRIGGERING;
    }

    public boolean isUnderAudit() {
        return auditState == AuditState.TESTING;
    }

    public void startAudit(ReportCategory category, Instant now) {
        if (auditState != AuditState.NONE) {
            throw new IllegalStateException("Freet " + id + " has already been audited: " + auditState);
        }
        auditState = AuditState.TESTING;
        auditCategory = category;
        auditTally = AuditTally.startedAt(now);
        cover = category.getCover();
    }

    /**
     * Move a running audit to its terminal state and apply the cover consequence.
     * Removal of spam and misinformation is left to the caller.
     */
    public void resolveAudit(boolean failed) {
        if (auditState != AuditState.TESTING) {
            throw new IllegalStateException("Freet " + id + " has no running audit: " + auditState);
        }
        if (failed) {
            auditState = AuditState.FAILED;
            if (!auditCategory.isRemovedOnFailedAudit()) {
                cover = Cover.TRIGGERING;
            }
        } else {
            auditState = AuditState.PASSED;
            flagged = downvotes > upvotes;
            cover = flagged ? Cover.CONTROVERSIAL : Cover.NONE;
        }
    }
}
