package com.fritter.freet.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's current vote on a freet. At most one row per (user, freet); the row
 * is deleted when the vote is toggled off.
 */
@Entity
@Table(name = "freet_votes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_freet_votes_user_freet", columnNames = {"user_id", "freet_id"})
        },
        indexes = {
                @Index(name = "idx_freet_votes_freet", columnList = "freet_id")
        })
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FreetVote {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "freet_id", nullable = false)
    private UUID freetId;

    @Column(name = "kind", nullable = false, length = 10)
    @Enumerated(EnumType.STRING)
    private VoteKind kind;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
