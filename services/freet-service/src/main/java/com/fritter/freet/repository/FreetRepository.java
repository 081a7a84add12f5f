package com.fritter.freet.repository;

import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Freet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FreetRepository extends JpaRepository<Freet, UUID> {

    /**
     * Find freet with pessimistic lock; every tally mutation goes through this
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Freet f WHERE f.id = :id")
    Optional<Freet> findByIdForUpdate(@Param("id") UUID id);

    List<Freet> findAllByOrderByModifiedAtDesc();

    List<Freet> findByAuthorIdOrderByModifiedAtDesc(UUID authorId);

    List<Freet> findByAuthorId(UUID authorId);

    List<Freet> findByModifiedAtGreaterThanEqual(Instant since);

    List<Freet> findByAuthorIdInAndModifiedAtGreaterThanEqual(Collection<UUID> authorIds, Instant since);

    List<Freet> findByAuthorIdNotInAndModifiedAtGreaterThanEqual(Collection<UUID> authorIds, Instant since);

    @Query("SELECT f FROM Freet f WHERE f.modifiedAt >= :since AND f.authorId IN " +
           "(SELECT u.id FROM FritterUser u WHERE u.verified = true)")
    List<Freet> findByVerifiedAuthorsSince(@Param("since") Instant since);

    @Query("SELECT f.id FROM Freet f WHERE f.auditState = :state AND f.auditTally.startedAt <= :cutoff")
    List<UUID> findIdsByAuditStateStartedAtOrBefore(@Param("state") AuditState state,
                                                    @Param("cutoff") Instant cutoff);
}
