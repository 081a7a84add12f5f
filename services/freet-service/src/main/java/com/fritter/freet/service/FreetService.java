package com.fritter.freet.service;

import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FritterUser;
import com.fritter.freet.exception.FreetModificationForbiddenException;
import com.fritter.freet.exception.FreetNotFoundException;
import com.fritter.freet.exception.InvalidFreetContentException;
import com.fritter.freet.exception.UserNotFoundException;
import com.fritter.freet.repository.FreetReportRepository;
import com.fritter.freet.repository.FreetRepository;
import com.fritter.freet.repository.FreetVoteRepository;
import com.fritter.freet.repository.FritterUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Creation, editing, lookup and removal of freets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class FreetService {

    private final FreetRepository freetRepository;
    private final FritterUserRepository userRepository;
    private final FreetVoteRepository voteRepository;
    private final FreetReportRepository reportRepository;
    private final FritterProperties properties;
    private final Clock clock;

    public Freet createFreet(UUID authorId, String content) {
        String validated = validateContent(content);
        if (!userRepository.existsById(authorId)) {
            throw new UserNotFoundException(authorId);
        }

        Instant now = Instant.now(clock);
        Freet freet = Freet.builder()
                .authorId(authorId)
                .content(validated)
                .createdAt(now)
                .modifiedAt(now)
                .build();

        freet = freetRepository.save(freet);
        log.info("Freet {} created by {}", freet.getId(), authorId);
        return freet;
    }

    @Transactional(readOnly = true)
    public Freet getFreet(UUID freetId) {
        return freetRepository.findById(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));
    }

    /**
     * Every freet, most recently modified first.
     */
    @Transactional(readOnly = true)
    public List<Freet> findAll() {
        return freetRepository.findAllByOrderByModifiedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<Freet> findAllByUsername(String username) {
        FritterUser author = userRepository.findByUsername(username)
                .orElseThrow(() -> new UserNotFoundException(username));
        return freetRepository.findByAuthorIdOrderByModifiedAtDesc(author.getId());
    }

    public Freet updateFreet(UUID freetId, UUID actingUserId, String content) {
        String validated = validateContent(content);
        Freet freet = freetRepository.findByIdForUpdate(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));
        requireAuthor(freet, actingUserId);

        freet.setContent(validated);
        freet.setModifiedAt(Instant.now(clock));
        return freetRepository.save(freet);
    }

    public void deleteFreet(UUID freetId, UUID actingUserId) {
        Freet freet = freetRepository.findByIdForUpdate(freetId)
                .orElseThrow(() -> new FreetNotFoundException(freetId));
        requireAuthor(freet, actingUserId);

        removeFreet(freet);
        log.info("Freet {} deleted by its author", freetId);
    }

    public int deleteAllByAuthor(UUID authorId) {
        List<Freet> freets = freetRepository.findByAuthorId(authorId);
        freets.forEach(this::removeFreet);
        log.info("Deleted {} freets of author {}", freets.size(), authorId);
        return freets.size();
    }

    /**
     * Delete a freet together with every vote and report ledger row that points at it.
     * Joins the caller's transaction, which should hold the freet lock.
     */
    public void removeFreet(Freet freet) {
        int votes = voteRepository.deleteAllByFreetId(freet.getId());
        int reports = reportRepository.deleteAllByFreetId(freet.getId());
        freetRepository.delete(freet);
        log.debug("Removed freet {} with {} votes and {} reports", freet.getId(), votes, reports);
    }

    String validateContent(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.isEmpty()) {
            throw new InvalidFreetContentException("Freet content must be at least one character long.");
        }
        int maxLength = properties.getFreet().getMaxLength();
        if (trimmed.length() > maxLength) {
            throw new InvalidFreetContentException(
                "Freet content must be no more than " + maxLength + " characters.");
        }
        return trimmed;
    }

    private void requireAuthor(Freet freet, UUID actingUserId) {
        if (!freet.getAuthorId().equals(actingUserId)) {
            throw new FreetModificationForbiddenException(freet.getId(), actingUserId);
        }
    }
}
