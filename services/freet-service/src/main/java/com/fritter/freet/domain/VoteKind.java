package com.fritter.freet.domain;

import com.fritter.common.exception.InvalidArgumentException;

import java.util.Locale;

public enum VoteKind {
    UPVOTE,
    DOWNVOTE;

    public static VoteKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("voteType", "Vote type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("voteType", "Unknown vote type: " + value);
        }
    }
}
