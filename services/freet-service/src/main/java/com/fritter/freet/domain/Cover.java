package com.fritter.freet.domain;

/**
 * Display hint telling clients to hide a freet behind a warning.
 */
public enum Cover {
    NONE,
    CONTROVERSIAL,
    SPAM,
    MISINFORMATION,
    OFFENSIVE,
    TRIGGERING
}
