package com.cadforge.core.model;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of geometric entity tracked by the model, with their degrees of freedom
 * and the numeric parameters each kind carries.
 */
public enum EntityType {
    POINT(2, List.of("x", "y"), List.of("z")),
    LINE(4, List.of("x1", "y1", "x2", "y2"), List.of("z1", "z2")),
    CIRCLE(3, List.of("cx", "cy", "r"), List.of("cz")),
    SKETCH(0, List.of(), List.of()),
    SOLID(0, List.of("height"), List.of());

    private final int degreesOfFreedom;
    private final List<String> requiredParameters;
    private final List<String> optionalParameters;

    EntityType(int degreesOfFreedom, List<String> requiredParameters, List<String> optionalParameters) {
        this.degreesOfFreedom = degreesOfFreedom;
        this.requiredParameters = requiredParameters;
        this.optionalParameters = optionalParameters;
    }

    public int degreesOfFreedom() {
        return degreesOfFreedom;
    }

    public List<String> requiredParameters() {
        return requiredParameters;
    }

    /** Parameters that default to 0 when omitted (the z coordinates). */
    public List<String> optionalParameters() {
        return optionalParameters;
    }

    public boolean accepts(String parameter) {
        return requiredParameters.contains(parameter) || optionalParameters.contains(parameter);
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value such as {@code "point"} or {@code "CIRCLE"}.
     *
     * @throws IllegalArgumentException if the value names no entity type
     */
    public static EntityType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Entity type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown entity type: " + value);
        }
    }
}
