package com.cadforge.core.model;

import java.util.Locale;

/**
 * How a merge treats conflicts that carry no explicit resolution.
 */
public enum MergeStrategy {
    AUTO,          // abort on any unresolved conflict
    KEEP_SOURCE,
    KEEP_TARGET,
    MANUAL;        // every conflict needs an explicit resolution

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MergeStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown merge strategy: " + value);
        }
    }
}
