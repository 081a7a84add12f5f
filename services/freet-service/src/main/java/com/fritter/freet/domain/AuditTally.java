package com.fritter.freet.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Confirm/reject votes of a running or finished community audit.
 * Absent (all columns null) while the freet has never been audited.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditTally {

    @Column(name = "audit_yes_count")
    private Integer yesCount;

    @Column(name = "audit_no_count")
    private Integer noCount;

    @Column(name = "audit_started_at")
    private Instant startedAt;

    public static AuditTally startedAt(Instant startedAt) {
        return new AuditTally(0, 0, startedAt);
    }

    public void record(boolean confirm) {
        if (confirm) {
            yesCount++;
        } else {
            noCount++;
        }
    }

    public boolean isWindowElapsed(Instant now, Duration window) {
        return Duration.between(startedAt, now).compareTo(window) >= 0;
    }

    /**
     * yes / no, with a zero "no" count treated as one.
     */
    public double confirmRatio() {
        return (double) yesCount / Math.max(noCount, 1);
    }
}
