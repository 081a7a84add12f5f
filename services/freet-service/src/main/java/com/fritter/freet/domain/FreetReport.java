package com.fritter.freet.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's open report against a freet. At most one row per (user, freet).
 */
@Entity
@Table(name = "freet_reports",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_freet_reports_user_freet", columnNames = {"user_id", "freet_id"})
        },
        indexes = {
                @Index(name = "idx_freet_reports_freet", columnList = "freet_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FreetReport {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "freet_id", nullable = false)
    private UUID freetId;

    @Column(name = "category", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private ReportCategory category;

    @Column(name = "reported_at", nullable = false)
    private Instant reportedAt;
}
