package com.fritter.freet.service;

import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FreetVote;
import com.fritter.freet.domain.VoteKind;
import com.fritter.freet.domain.VoteTransition;
import com.fritter.freet.exception.FreetNotFoundException;
import com.fritter.freet.exception.UserNotFoundException;
import com.fritter.freet.repository.FreetRepository;
import com.fritter.freet.repository.FreetVoteRepository;
import com.fritter.freet.repository.FritterUserRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies up/down votes to a freet while keeping each user's vote ledger in step.
 *
 * The freet row is locked for the whole transaction so that read-tally, compute and
 * write-tally are atomic per freet, including the voting user's ledger row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VoteLedgerService {

    private final FreetRepository freetRepository;
    private final FritterUserRepository userRepository;
    private final FreetVoteRepository voteRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public Freet vote(UUID freetId, UUID userId, VoteKind requested) {
        if (!userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        Freet freet = freetRepository.findByIdForUpdate(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));

        Optional<FreetVote> existing = voteRepository.findByUserIdAndFreetId(userId, freetId);
        VoteKind current = existing.map(FreetVote::getKind).orElse(null);
        VoteTransition transition = VoteTransition.between(current, requested);

        freet.adjustVotes(transition.getUpvoteDelta(), transition.getDownvoteDelta());
        freet.refreshVoteDerivedState();
        recordLedger(existing, freetId, userId, transition);

        freet = freetRepository.save(freet);

        log.debug("Vote on freet {} by {}: {} -> {} (tally {}/{})", freetId, userId,
            current, transition.getResulting(), freet.getUpvotes(), freet.getDownvotes());
        meterRegistry.counter("fritter.votes",
            "kind", requested.name(),
            "retraction", String.valueOf(transition.isRetraction())).increment();
        return freet;
    }

    private void recordLedger(Optional<FreetVote> existing, UUID freetId, UUID userId, VoteTransition transition) {
        if (transition.isRetraction()) {
            existing.ifPresent(voteRepository::delete);
            return;
        }
        FreetVote vote = existing.orElseGet(() -> FreetVote.builder()
                .userId(userId)
                .freetId(freetId)
                .build());
        vote.setKind(transition.getResulting());
        vote.setUpdatedAt(Instant.now(clock));
        voteRepository.save(vote);
    }
}
