package com.cadforge.core.entity;

import com.cadforge.core.error.InvalidEntityException;
import com.cadforge.core.model.EntityType;

import java.util.HashMap;
import java.util.Map;

/**
 * Parameter validation shared by entity creation, updates and manual merge resolutions.
 */
public final class EntityParameters {

    private EntityParameters() {}

    /**
     * Complete, validated parameter map for an entity type. Optional
     * coordinates default to 0.
     *
     * @throws InvalidEntityException on unknown, missing or non-finite parameters, a
     *                                non-positive radius or height, or a zero-length line
     */
    public static Map<String, Double> normalize(EntityType type, Map<String, Double> parameters) {
        Map<String, Double> params = parameters == null ? Map.of() : parameters;
        Map<String, Double> result = new HashMap<>();
        for (var entry : params.entrySet()) {
            if (!type.accepts(entry.getKey())) {
                throw new InvalidEntityException("Unknown parameter '" + entry.getKey() + "' for " + type.value(),
                        Map.of("entity_type", type.value(), "parameter", entry.getKey()));
            }
            Double value = entry.getValue();
            if (value == null || !Double.isFinite(value)) {
                throw new InvalidEntityException("Parameter '" + entry.getKey() + "' must be a finite number",
                        Map.of("entity_type", type.value(), "parameter", entry.getKey()));
            }
            result.put(entry.getKey(), value);
        }
        for (String required : type.requiredParameters()) {
            if (!result.containsKey(required)) {
                throw new InvalidEntityException("Missing parameter '" + required + "' for " + type.value(),
                        Map.of("entity_type", type.value(), "parameter", required));
            }
        }
        for (String optional : type.optionalParameters()) {
            result.putIfAbsent(optional, 0.0);
        }

        switch (type) {
            case CIRCLE -> requirePositive(type, "r", result.get("r"));
            case SOLID -> requirePositive(type, "height", result.get("height"));
            case LINE -> {
                double dx = result.get("x2") - result.get("x1");
                double dy = result.get("y2") - result.get("y1");
                double dz = result.get("z2") - result.get("z1");
                if (dx == 0 && dy == 0 && dz == 0) {
                    throw new InvalidEntityException("A line needs distinct start and end points",
                            Map.of("entity_type", type.value()));
                }
            }
            case POINT, SKETCH -> {
                // any finite coordinates
            }
        }
        return result;
    }

    private static void requirePositive(EntityType type, String key, double value) {
        if (value <= 0) {
            throw new InvalidEntityException("Parameter '" + key + "' of a " + type.value() + " must be positive",
                    Map.of("entity_type", type.value(), "parameter", key, "value", value));
        }
    }
}
