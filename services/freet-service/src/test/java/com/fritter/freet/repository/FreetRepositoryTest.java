package com.fritter.freet.repository;

import com.fritter.freet.domain.AuditState;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FreetReport;
import com.fritter.freet.domain.FreetVote;
import com.fritter.freet.domain.FritterUser;
import com.fritter.freet.domain.ReportCategory;
import com.fritter.freet.domain.VoteKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("FreetRepository Integration Tests")
class FreetRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-08T12:00:00Z");
    private static final Instant WEEK_AGO = NOW.minus(Duration.ofDays(7));

    @Autowired
    private FreetRepository freetRepository;

    @Autowired
    private FreetVoteRepository voteRepository;

    @Autowired
    private FreetReportRepository reportRepository;

    @Autowired
    private FritterUserRepository userRepository;

    @Autowired
    private TestEntityManager entityManager;

    private FritterUser verifiedUser;
    private FritterUser regularUser;

    @BeforeEach
    void setUp() {
        verifiedUser = userRepository.save(FritterUser.builder().username("verified").verified(true).build());
        regularUser = userRepository.save(FritterUser.builder().username("regular").build());
    }

    private Freet persistFreet(FritterUser author, Instant modifiedAt) {
        return entityManager.persistAndFlush(Freet.builder()
                .authorId(author.getId())
                .content("by " + author.getUsername())
                .createdAt(modifiedAt)
                .modifiedAt(modifiedAt)
                .build());
    }

    @Test
    @DisplayName("Should find recent freets of verified authors only")
    void shouldFindVerifiedAuthorsFreets() {
        Freet recentVerified = persistFreet(verifiedUser, NOW.minus(Duration.ofDays(1)));
        persistFreet(verifiedUser, NOW.minus(Duration.ofDays(8)));
        persistFreet(regularUser, NOW.minus(Duration.ofDays(1)));

        List<Freet> found = freetRepository.findByVerifiedAuthorsSince(WEEK_AGO);

        assertThat(found).extracting(Freet::getId).containsExactly(recentVerified.getId());
    }

    @Test
    @DisplayName("Should split recent freets by followed authors")
    void shouldSplitByFollowedAuthors() {
        Freet followed = persistFreet(verifiedUser, NOW.minus(Duration.ofHours(2)));
        Freet other = persistFreet(regularUser, NOW.minus(Duration.ofHours(3)));
        Set<UUID> follows = Set.of(verifiedUser.getId());

        assertThat(freetRepository.findByAuthorIdInAndModifiedAtGreaterThanEqual(follows, WEEK_AGO))
                .extracting(Freet::getId).containsExactly(followed.getId());
        assertThat(freetRepository.findByAuthorIdNotInAndModifiedAtGreaterThanEqual(follows, WEEK_AGO))
                .extracting(Freet::getId).containsExactly(other.getId());
    }

    @Test
    @DisplayName("Should list freets newest modification first")
    void shouldOrderByModification() {
        Freet older = persistFreet(regularUser, NOW.minus(Duration.ofHours(5)));
        Freet newer = persistFreet(regularUser, NOW.minus(Duration.ofHours(1)));

        assertThat(freetRepository.findByAuthorIdOrderByModifiedAtDesc(regularUser.getId()))
                .extracting(Freet::getId).containsExactly(newer.getId(), older.getId());
    }

    @Test
    @DisplayName("Should load a freet for update with its embedded tallies")
    void shouldLoadForUpdate() {
        Freet freet = persistFreet(regularUser, NOW);
        entityManager.clear();

        Freet locked = freetRepository.findByIdForUpdate(freet.getId()).orElseThrow();

        assertThat(locked.getReportTally()).isNotNull();
        assertThat(locked.getReportTally().total()).isZero();
        assertThat(locked.getAuditTally()).isNull();
        assertThat(locked.getAuditState()).isEqualTo(AuditState.NONE);
    }

    @Test
    @DisplayName("Should find audits started at or before the cutoff")
    void shouldFindExpiredAudits() {
        Freet expired = persistFreet(regularUser, NOW);
        expired.startAudit(ReportCategory.SPAM, NOW.minus(Duration.ofHours(13)));
        Freet running = persistFreet(regularUser, NOW);
        running.startAudit(ReportCategory.OFFENSIVE, NOW.minus(Duration.ofHours(1)));
        entityManager.flush();

        List<UUID> ids = freetRepository.findIdsByAuditStateStartedAtOrBefore(AuditState.TESTING,
            NOW.minus(Duration.ofHours(12)));

        assertThat(ids).containsExactly(expired.getId());
    }

    @Test
    @DisplayName("Should purge ledger rows of a freet")
    void shouldPurgeLedgers() {
        Freet freet = persistFreet(regularUser, NOW);
        voteRepository.save(FreetVote.builder().userId(verifiedUser.getId()).freetId(freet.getId())
                .kind(VoteKind.UPVOTE).updatedAt(NOW).build());
        voteRepository.save(FreetVote.builder().userId(regularUser.getId()).freetId(freet.getId())
                .kind(VoteKind.DOWNVOTE).updatedAt(NOW).build());
        reportRepository.save(FreetReport.builder().userId(verifiedUser.getId()).freetId(freet.getId())
                .category(ReportCategory.SPAM).reportedAt(NOW).build());
        entityManager.flush();

        assertThat(voteRepository.countByFreetIdAndKind(freet.getId(), VoteKind.UPVOTE)).isEqualTo(1);
        assertThat(voteRepository.deleteAllByFreetId(freet.getId())).isEqualTo(2);
        assertThat(reportRepository.deleteAllByFreetId(freet.getId())).isEqualTo(1);
        assertThat(reportRepository.countByFreetId(freet.getId())).isZero();
    }

    @Test
    @DisplayName("Should allow only one vote row per user and freet")
    void shouldEnforceOneVotePerUser() {
        Freet freet = persistFreet(regularUser, NOW);
        voteRepository.saveAndFlush(FreetVote.builder().userId(verifiedUser.getId()).freetId(freet.getId())
                .kind(VoteKind.UPVOTE).updatedAt(NOW).build());

        assertThatThrownBy(() -> voteRepository.saveAndFlush(FreetVote.builder().userId(verifiedUser.getId())
                .freetId(freet.getId()).kind(VoteKind.DOWNVOTE).updatedAt(NOW).build()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Should find users by username with their follows")
    void shouldFindUserByUsername() {
        regularUser.getFollows().add(verifiedUser.getId());
        userRepository.saveAndFlush(regularUser);
        entityManager.clear();

        FritterUser found = userRepository.findByUsername("regular").orElseThrow();

        assertThat(found.getFollows()).containsExactly(verifiedUser.getId());
        assertThat(found.isVerified()).isFalse();
    }
}
