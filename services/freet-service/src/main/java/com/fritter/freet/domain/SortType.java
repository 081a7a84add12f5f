package com.fritter.freet.domain;

import com.fritter.common.exception.InvalidArgumentException;

import java.util.Locale;

public enum SortType {
    BEST,
    HOT,
    RISING,
    NEW;

    public static SortType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException("sortType", "Sort type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("sortType", "Unknown sort type: " + value);
        }
    }
}
