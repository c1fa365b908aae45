package com.cadforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One immutable version of a geometric entity. Every mutation produces a new
 * instance with a higher {@code version}; earlier versions stay in the store.
 *
 * @param id         workspace-qualified identifier, e.g. {@code main:point_1a2b3c4d}
 * @param type       entity kind
 * @param parameters named numeric parameters, always finite
 * @param version    per-entity version, starting at 1
 * @param parentIds  ids of the entities this one belongs to (sketch, solid profile)
 * @param createdBy  agent that created the entity
 * @param createdAt  creation time of version 1
 * @param modifiedAt creation time of this version
 */
public record Entity(
    String id,
    EntityType type,
    Map<String, Double> parameters,
    long version,
    List<String> parentIds,
    String createdBy,
    Instant createdAt,
    Instant modifiedAt
) implements Serializable {

    public Entity {
        parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
        parentIds = List.copyOf(parentIds);
    }

    public double param(String key) {
        Double value = parameters.get(key);
        if (value == null) {
            throw new IllegalStateException("Entity " + id + " has no parameter '" + key + "'");
        }
        return value;
    }

    /**
     * Next version of this entity with the given parameters.
     */
    public Entity withParameters(Map<String, Double> newParameters, Instant now) {
        return new Entity(id, type, newParameters, version + 1, parentIds, createdBy, createdAt, now);
    }

    /**
     * Copy of this entity content stamped with an explicit version.
     */
    public Entity withVersion(long newVersion, Instant now) {
        return new Entity(id, type, parameters, newVersion, parentIds, createdBy, createdAt, now);
    }

    /**
     * True when both carry the same geometry and parents, ignoring version and timestamps.
     */
    public boolean sameContent(Entity other) {
        return other != null
                && type == other.type
                && parameters.equals(other.parameters)
                && parentIds.equals(other.parentIds);
    }

    public static boolean sameContent(Entity a, Entity b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.sameContent(b);
    }
}
