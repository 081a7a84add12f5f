package com.fritter.freet.domain;

/**
 * How the discovery tab fills its slots from the followed and non-followed pools.
 */
public enum DiscoverySampling {
    /** Each slot is an independent uniform draw; freets may repeat or be skipped. */
    WITH_REPLACEMENT,
    /** Pools are shuffled and consumed; every candidate appears exactly once. */
    WITHOUT_REPLACEMENT
}
