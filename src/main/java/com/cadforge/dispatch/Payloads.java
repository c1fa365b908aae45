package com.cadforge.dispatch;

import com.cadforge.core.error.InvalidConstraintException;
import com.cadforge.core.error.InvalidEntityException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.ConstraintType;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.MergeStrategy;
import com.cadforge.core.model.ResolutionOption;

import java.util.Map;

/**
 * Parsing of the string-typed request fields shared by the REST controllers
 * and the JSON-RPC dispatcher. Unknown values become the matching domain error.
 */
public final class Payloads {

    private Payloads() {
        // utility class
    }

    public static EntityType entityType(String value) {
        try {
            return EntityType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidEntityException("Unknown entity type: " + value,
                    Map.of("type", String.valueOf(value)));
        }
    }

    public static EntityType entityTypeOrNull(String value) {
        return value == null || value.isBlank() ? null : entityType(value);
    }

    public static ConstraintType constraintType(String value) {
        try {
            return ConstraintType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidConstraintException("Unknown constraint type: " + value,
                    Map.of("constraint_type", String.valueOf(value)));
        }
    }

    public static MergeStrategy mergeStrategy(String value) {
        try {
            return MergeStrategy.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidOperationException(e.getMessage(), Map.of("strategy", value));
        }
    }

    public static ConflictResolution resolution(String option, Map<String, Double> parameters) {
        try {
            return new ConflictResolution(ResolutionOption.fromValue(option), parameters);
        } catch (IllegalArgumentException e) {
            throw new InvalidOperationException(e.getMessage(), Map.of("option", String.valueOf(option)));
        }
    }
}
