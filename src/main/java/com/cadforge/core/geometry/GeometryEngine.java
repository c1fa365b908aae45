package com.cadforge.core.geometry;

import com.cadforge.core.model.Entity;

import java.util.Map;

/**
 * Numeric questions the constraint solver asks about entity geometry.
 * Implementations may delegate to a full B-rep kernel; the solver only needs
 * these measurements.
 */
public interface GeometryEngine {

    /**
     * Derived properties of an entity, such as a line's length or a circle's area.
     */
    Map<String, Double> evaluate(Entity entity);

    /**
     * Distance between the anchor points of two entities (a point itself,
     * the start of a line, the centre of a circle).
     */
    double distance(Entity a, Entity b);

    /**
     * Angle in radians, in [0, &pi;], between the directions of two lines.
     */
    double angle(Entity lineA, Entity lineB);

    /**
     * Unit direction of a line.
     */
    Vector3 direction(Entity line);

    /**
     * Distance from a point to the infinite line through a line entity.
     */
    double distanceToLine(Vector3 point, Entity line);
}
