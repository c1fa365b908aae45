package com.cadforge.core.model;

import java.util.Locale;

/**
 * Evaluation state of a constraint against the current geometry.
 */
public enum ConstraintStatus {
    SATISFIED,
    VIOLATED,
    REDUNDANT;  // equivalent to an existing constraint, removes no DOF

    /** Lower-case wire name. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
