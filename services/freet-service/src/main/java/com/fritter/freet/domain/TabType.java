package com.fritter.freet.domain;

import com.fritter.common.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Named feed views.
 */
public enum TabType {
    HOME,
    VERIFIED,
    DISCOVERY;

    public static TabType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("tabType", "Tab type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("tabType", "Unknown tab type: " + value);
        }
    }
}
