package com.fritter.freet.service;

import com.fritter.freet.domain.DiscoverySampling;
import com.fritter.freet.domain.Freet;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Mixes followed and non-followed freets for the discovery tab: every fourth slot
 * (index 0, 4, 8, ...) comes from the non-followed pool, the rest from the followed pool.
 */
@Component
@RequiredArgsConstructor
public class DiscoveryInterleaver {

    private final RandomSource randomSource;

    public List<Freet> interleave(List<Freet> followed, List<Freet> notFollowed, DiscoverySampling sampling) {
        switch (sampling) {
            case WITH_REPLACEMENT:
                return sampleWithReplacement(followed, notFollowed);
            case WITHOUT_REPLACEMENT:
                return sampleWithoutReplacement(followed, notFollowed);
            default:
                throw new IllegalArgumentException("Unhandled discovery sampling: " + sampling);
        }
    }

    /**
     * One slot per non-followed freet, each an independent uniform draw from its pool.
     * Slots whose pool is empty are skipped.
     */
    private List<Freet> sampleWithReplacement(List<Freet> followed, List<Freet> notFollowed) {
        List<Freet> mixed = new ArrayList<>(notFollowed.size());
        for (int slot = 0; slot < notFollowed.size(); slot++) {
            List<Freet> pool = isDiscoverySlot(slot) ? notFollowed : followed;
            if (pool.isEmpty()) {
                continue;
            }
            mixed.add(pool.get(randomSource.nextInt(pool.size())));
        }
        return mixed;
    }

    /**
     * Shuffled pools consumed in the same 1-in-4 pattern; when one pool runs dry the
     * other fills the remaining slots.
     */
    private List<Freet> sampleWithoutReplacement(List<Freet> followed, List<Freet> notFollowed) {
        Deque<Freet> followedQueue = new ArrayDeque<>(shuffled(followed));
        Deque<Freet> discoveryQueue = new ArrayDeque<>(shuffled(notFollowed));
        int slots = followed.size() + notFollowed.size();
        List<Freet> mixed = new ArrayList<>(slots);
        for (int slot = 0; slot < slots; slot++) {
            Deque<Freet> preferred = isDiscoverySlot(slot) ? discoveryQueue : followedQueue;
            Deque<Freet> fallback = preferred == discoveryQueue ? followedQueue : discoveryQueue;
            mixed.add(preferred.isEmpty() ? fallback.poll() : preferred.poll());
        }
        return mixed;
    }

    private List<Freet> shuffled(List<Freet> freets) {
        List<Freet> copy = new ArrayList<>(freets);
        for (int i = copy.size() - 1; i > 0; i--) {
            Collections.swap(copy, i, randomSource.nextInt(i + 1));
        }
        return copy;
    }

    private static boolean isDiscoverySlot(int slot) {
        return slot % 4 == 0;
    }
}
