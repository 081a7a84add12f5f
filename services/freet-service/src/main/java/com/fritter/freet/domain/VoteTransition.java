package com.fritter.freet.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Objects;

/**
 * Effect of a vote request given the user's current vote on a freet.
 *
 * <pre>
 * current   requested  upvotes downvotes  resulting
 * none      UPVOTE       +1       0       UPVOTE
 * none      DOWNVOTE      0      +1       DOWNVOTE
 * UPVOTE    UPVOTE       -1       0       none
 * DOWNVOTE  DOWNVOTE      0      -1       none
 * UPVOTE    DOWNVOTE     -1      +1       DOWNVOTE
 * DOWNVOTE  UPVOTE       +1      -1       UPVOTE
 * </pre>
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class VoteTransition {

    private final int upvoteDelta;
    private final int downvoteDelta;
    /** The user's vote after the transition, or null when it was toggled off. */
    private final VoteKind resulting;

    public static VoteTransition between(VoteKind current, VoteKind requested) {
        Objects.requireNonNull(requested, "requested vote kind");
        if (current == null) {
            return requested == VoteKind.UPVOTE
                ? new VoteTransition(1, 0, VoteKind.UPVOTE)
                : new VoteTransition(0, 1, VoteKind.DOWNVOTE);
        }
        if (current == requested) {
            return requested == VoteKind.UPVOTE
                ? new VoteTransition(-1, 0, null)
                : new VoteTransition(0, -1, null);
        }
        return requested == VoteKind.UPVOTE
            ? new VoteTransition(1, -1, VoteKind.UPVOTE)
            : new VoteTransition(-1, 1, VoteKind.DOWNVOTE);
    }

    public boolean isRetraction() {
        return resulting == null;
    }
}
