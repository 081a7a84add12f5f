package com.fritter.freet.domain;

import com.fritter.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Reasons a user can report a freet. Declaration order is the tie-break order
 * when picking the dominant category of a report tally.
 */
public enum ReportCategory {
    SPAM(Cover.SPAM, true),
    MISINFORMATION(Cover.MISINFORMATION, true),
    OFFENSIVE(Cover.OFFENSIVE, false);

    private final Cover cover;
    private final boolean removedOnFailedAudit;

    ReportCategory(Cover cover, boolean removedOnFailedAudit) {
        this.cover = cover;
        this.removedOnFailedAudit = removedOnFailedAudit;
    }

    /**
     * Cover shown while an audit for this category is running.
     */
    public Cover getCover() {
        return cover;
    }

    /**
     * Whether a failed audit deletes the freet; otherwise it is covered as triggering.
     */
    public boolean isRemovedOnFailedAudit() {
        return removedOnFailedAudit;
    }

    public static ReportCategory fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("reportType", "Report type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        // "triggering" is the label the client uses for offensive content
        if ("TRIGGERING".equals(normalized)) {
            return OFFENSIVE;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("reportType", "Unknown report type: " + value);
        }
    }
}
