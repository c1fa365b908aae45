package com.cadforge.core.geometry;

import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Closed-form geometry for points, lines and circles.
 */
@Component
public class AnalyticGeometryEngine implements GeometryEngine {

    @Override
    public Map<String, Double> evaluate(Entity entity) {
        Map<String, Double> properties = new LinkedHashMap<>();
        switch (entity.type()) {
            case POINT -> {
                properties.put("x", entity.param("x"));
                properties.put("y", entity.param("y"));
                properties.put("z", entity.param("z"));
            }
            case LINE -> {
                Vector3 start = start(entity);
                Vector3 end = end(entity);
                Vector3 dir = direction(entity);
                properties.put("length", start.distanceTo(end));
                properties.put("dx", dir.x());
                properties.put("dy", dir.y());
                properties.put("dz", dir.z());
            }
            case CIRCLE -> {
                double r = entity.param("r");
                properties.put("radius", r);
                properties.put("diameter", 2 * r);
                properties.put("circumference", 2 * Math.PI * r);
                properties.put("area", Math.PI * r * r);
            }
            case SOLID -> properties.put("height", entity.param("height"));
            case SKETCH -> {
                // no intrinsic geometry
            }
        }
        return properties;
    }

    @Override
    public double distance(Entity a, Entity b) {
        return anchor(a).distanceTo(anchor(b));
    }

    @Override
    public double angle(Entity lineA, Entity lineB) {
        double cos = direction(lineA).dot(direction(lineB));
        return Math.acos(Math.max(-1.0, Math.min(1.0, cos)));
    }

    @Override
    public Vector3 direction(Entity line) {
        requireType(line, EntityType.LINE);
        return end(line).minus(start(line)).normalized();
    }

    @Override
    public double distanceToLine(Vector3 point, Entity line) {
        Vector3 origin = start(line);
        return point.minus(origin).cross(direction(line)).length();
    }

    /**
     * Reference point used for distances: the point itself, a line's start or a circle's centre.
     */
    public static Vector3 anchor(Entity entity) {
        return switch (entity.type()) {
            case POINT -> new Vector3(entity.param("x"), entity.param("y"), entity.param("z"));
            case LINE -> start(entity);
            case CIRCLE -> center(entity);
            case SKETCH, SOLID -> throw new IllegalArgumentException(
                    "Entity " + entity.id() + " of type " + entity.type() + " has no anchor point");
        };
    }

    public static Vector3 center(Entity circle) {
        requireType(circle, EntityType.CIRCLE);
        return new Vector3(circle.param("cx"), circle.param("cy"), circle.param("cz"));
    }

    private static Vector3 start(Entity line) {
        return new Vector3(line.param("x1"), line.param("y1"), line.param("z1"));
    }

    private static Vector3 end(Entity line) {
        return new Vector3(line.param("x2"), line.param("y2"), line.param("z2"));
    }

    private static void requireType(Entity entity, EntityType type) {
        if (entity.type() != type) {
            throw new IllegalArgumentException("Entity " + entity.id() + " is a " + entity.type() + ", expected " + type);
        }
    }
}
