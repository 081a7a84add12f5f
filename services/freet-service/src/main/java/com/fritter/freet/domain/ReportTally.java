package com.fritter.freet.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Open report counts of a freet, one field per {@link ReportCategory}.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportTally {

    @Column(name = "spam_reports", nullable = false)
    private int spam;

    @Column(name = "misinformation_reports", nullable = false)
    private int misinformation;

    @Column(name = "offensive_reports", nullable = false)
    private int offensive;

    public static ReportTally empty() {
        return new ReportTally(0, 0, 0);
    }

    public int count(ReportCategory category) {
        switch (category) {
            case SPAM: return spam;
            case MISINFORMATION: return misinformation;
            case OFFENSIVE: return offensive;
            default: throw new IllegalArgumentException("Unhandled report category: " + category);
        }
    }

    public void increment(ReportCategory category) {
        set(category, count(category) + 1);
    }

    public void decrement(ReportCategory category) {
        int current = count(category);
        if (current == 0) {
            throw new IllegalStateException("Report tally for " + category + " is already zero");
        }
        set(category, current - 1);
    }

    public int total() {
        return spam + misinformation + offensive;
    }

    /**
     * Category with the highest count; ties go to the category declared first.
     */
    public ReportCategory dominantCategory() {
        ReportCategory dominant = ReportCategory.values()[0];
        for (ReportCategory category : ReportCategory.values()) {
            if (count(category) > count(dominant)) {
                dominant = category;
            }
        }
        return dominant;
    }

    private void set(ReportCategory category, int value) {
        switch (category) {
            case SPAM: spam = value; break;
            case MISINFORMATION: misinformation = value; break;
            case OFFENSIVE: offensive = value; break;
            default: throw new IllegalArgumentException("Unhandled report category: " + category);
        }
    }
}
