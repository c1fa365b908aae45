package com.cadforge.core.model;

import java.util.Locale;

/**
 * Ways a merge conflict can be resolved.
 */
public enum ResolutionOption {
    KEEP_SOURCE,
    KEEP_TARGET,
    MANUAL_MERGE;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResolutionOption fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Resolution option is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resolution option: " + value);
        }
    }
}
