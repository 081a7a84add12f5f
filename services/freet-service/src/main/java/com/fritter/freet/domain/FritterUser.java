package com.fritter.freet.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * The slice of a user account the feed needs. Accounts and follow lists are
 * maintained elsewhere; this service only reads them.
 */
@Entity
@Table(name = "fritter_users", indexes = {
        @Index(name = "idx_fritter_users_username", columnList = "username", unique = true),
        @Index(name = "idx_fritter_users_verified", columnList = "verified")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FritterUser {

    @Id
    @GeneratedValue
    private UUID id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "verified", nullable = false)
    @Builder.Default
    private boolean verified = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fritter_user_follows", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "followed_user_id", nullable = false)
    @Builder.Default
    private Set<UUID> follows = new HashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
