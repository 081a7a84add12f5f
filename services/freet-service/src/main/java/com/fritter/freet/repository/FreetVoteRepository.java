package com.fritter.freet.repository;

import com.fritter.freet.domain.FreetVote;
import com.fritter.freet.domain.VoteKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface FreetVoteRepository extends JpaRepository<FreetVote, UUID> {

    Optional<FreetVote> findByUserIdAndFreetId(UUID userId, UUID freetId);

    long countByFreetIdAndKind(UUID freetId, VoteKind kind);

    @Modifying
    @Query("DELETE FROM FreetVote v WHERE v.freetId = :freetId")
    int deleteAllByFreetId(@Param("freetId") UUID freetId);
}
