package com.cadforge.core.model;

import java.util.Locale;

/**
 * Why an entity could not be merged automatically.
 */
public enum ConflictType {
    BOTH_MODIFIED,
    DELETE_MODIFIED;

    /** Lower-case wire name. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
