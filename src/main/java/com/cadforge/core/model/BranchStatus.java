package com.cadforge.core.model;

import java.util.Locale;

/**
 * Lifecycle of a workspace relative to its last synchronisation point.
 */
public enum BranchStatus {
    CLEAN,
    MODIFIED,
    MERGED;

    /** Lower-case wire name. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
