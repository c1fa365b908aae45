package com.cadforge.core.model;

import java.util.Locale;

/**
 * Geometric relationships an agent can declare between entities.
 */
public enum ConstraintType {
    COINCIDENT(2, null),
    PARALLEL(1, null),
    PERPENDICULAR(1, null),
    TANGENT(1, null),
    DISTANCE(1, "distance"),
    ANGLE(1, "angle"),
    RADIUS(1, "radius");

    private final int dofRemoved;
    private final String parameterKey;

    ConstraintType(int dofRemoved, String parameterKey) {
        this.dofRemoved = dofRemoved;
        this.parameterKey = parameterKey;
    }

    public int dofRemoved() {
        return dofRemoved;
    }

    /** Name of the target-value parameter, or null for purely relational constraints. */
    public String parameterKey() {
        return parameterKey;
    }

    public boolean isDimensional() {
        return parameterKey != null;
    }

    /** Angular constraints are compared against the angular tolerance. */
    public boolean isAngular() {
        return this == PARALLEL || this == PERPENDICULAR || this == ANGLE;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConstraintType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Constraint type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown constraint type: " + value);
        }
    }
}
