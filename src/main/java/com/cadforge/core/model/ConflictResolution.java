package com.cadforge.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * An agent's decision for one conflicting entity.
 *
 * @param option     chosen resolution
 * @param parameters parameters overriding the target version; used with {@link ResolutionOption#MANUAL_MERGE}
 */
public record ConflictResolution(
    ResolutionOption option,
    Map<String, Double> parameters
) implements Serializable {

    public ConflictResolution {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static ConflictResolution of(ResolutionOption option) {
        return new ConflictResolution(option, Map.of());
    }
}
