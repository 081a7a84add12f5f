package com.fritter.freet.service;

import com.fritter.freet.domain.Freet;
import com.fritter.freet.domain.SortType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores and orders freets for the feed sort methods.
 *
 * <ul>
 *   <li>best: upvotes - downvotes</li>
 *   <li>hot: upvotes + downvotes / 2</li>
 *   <li>rising: 2 * (0.5 + max(0, 1 - ageInDays)) * (upvotes - downvotes)</li>
 *   <li>new: modification time</li>
 * </ul>
 *
 * Sorting is descending and stable, and never touches the freets themselves.
 */
@Component
@RequiredArgsConstructor
public class FreetRanker {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final Clock clock;

    public double score(Freet freet, SortType sortType) {
        return score(freet, sortType, Instant.now(clock));
    }

    public double score(Freet freet, SortType sortType, Instant now) {
        Objects.requireNonNull(sortType, "sortType");
        switch (sortType) {
            case BEST:
                return freet.netScore();
            case HOT:
                return freet.getUpvotes() + freet.getDownvotes() / 2.0;
            case RISING:
                double ageInDays = Duration.between(freet.getCreatedAt(), now).toMillis() / MILLIS_PER_DAY;
                return 2 * (0.5 + Math.max(0, 1 - ageInDays)) * freet.netScore();
            case NEW:
                return freet.getModifiedAt().toEpochMilli();
            default:
                throw new IllegalArgumentException("Unhandled sort type: " + sortType);
        }
    }

    /**
     * @return a new list holding the same freets, highest score first; ties keep input order
     */
    public List<Freet> sort(Collection<Freet> freets, SortType sortType) {
        Objects.requireNonNull(sortType, "sortType");
        List<Freet> ordered = new ArrayList<>(freets);
        ordered.sort(comparator(sortType, Instant.now(clock)));
        return ordered;
    }

    private Comparator<Freet> comparator(SortType sortType, Instant now) {
        if (sortType == SortType.NEW) {
            return Comparator.comparing(Freet::getModifiedAt).reversed();
        }
        return Comparator.comparingDouble((Freet freet) -> score(freet, sortType, now)).reversed();
    }
}
