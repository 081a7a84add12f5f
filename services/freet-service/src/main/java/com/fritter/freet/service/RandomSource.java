package com.fritter.freet.service;

/**
 * Uniform random picks used by the discovery feed. Swapped for a scripted source in tests.
 */
public interface RandomSource {

    /**
     * @return a uniformly distributed int in {@code [0, bound)}
     */
    int nextInt(int bound);
}
