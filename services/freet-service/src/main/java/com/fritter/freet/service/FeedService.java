package com.fritter.freet.service;

import com.fritter.common.exception.InvalidArgumentException;
import com.fritter.freet.config.FritterProperties;
import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.FritterUser;
import com.fritter.freet.domain.SortType;
import com.fritter.freet.domain.TabType;
import com.fritter.freet.exception.UserNotFoundException;
import com.fritter.freet.repository.FreetRepository;
import com.fritter.freet.repository.FritterUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Builds the named feed tabs (home, verified, discovery) for a user.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class FeedService {

    private final FreetRepository freetRepository;
    private final FritterUserRepository userRepository;
    private final FreetRanker ranker;
    private final DiscoveryInterleaver interleaver;
    private final FritterProperties properties;
    private final Clock clock;

    /**
     * Tab built from freets modified within the configured lookback (a week by default).
     */
    public List<Freet> chooseTab(UUID userId, TabType tabType, SortType sortType) {
        Instant since = Instant.now(clock).minus(properties.getFeed().getLookback());
        return chooseTab(userId, tabType, sortType, since);
    }

    public List<Freet> chooseTab(UUID userId, TabType tabType, SortType sortType, Instant since) {
        if (tabType == null) {
            throw new InvalidArgumentException("tabType", "Tab type is required");
        }
        if (sortType == null) {
            throw new InvalidArgumentException("sortType", "Sort type is required");
        }
        FritterUser user = userRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        Set<UUID> follows = user.getFollows();

        List<Freet> candidates;
        switch (tabType) {
            case HOME:
                candidates = findFollowing(follows, since);
                break;
            case VERIFIED:
                candidates = freetRepository.findByVerifiedAuthorsSince(since);
                break;
            case DISCOVERY:
                candidates = interleaver.interleave(findFollowing(follows, since), findNotFollowing(follows, since),
                    properties.getFeed().getDiscoverySampling());
                break;
            default:
                throw new InvalidArgumentException("tabType", "Unsupported tab type: " + tabType);
        }

        log.debug("Feed {} / {} for user {}: {} freets since {}", tabType, sortType, userId, candidates.size(), since);
        return ranker.sort(candidates, sortType);
    }

    private List<Freet> findFollowing(Set<UUID> follows, Instant since) {
        if (follows.isEmpty()) {
            return Collections.emptyList();
        }
        return freetRepository.findByAuthorIdInAndModifiedAtGreaterThanEqual(follows, since);
    }

    private List<Freet> findNotFollowing(Set<UUID> follows, Instant since) {
        if (follows.isEmpty()) {
            return freetRepository.findByModifiedAtGreaterThanEqual(since);
        }
        return freetRepository.findByAuthorIdNotInAndModifiedAtGreaterThanEqual(follows, since);
    }
}
