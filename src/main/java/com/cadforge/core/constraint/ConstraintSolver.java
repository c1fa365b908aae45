package com.cadforge.core.constraint;

import com.cadforge.core.config.CadforgeProperties;
import com.cadforge.core.error.ConstraintConflictException;
import com.cadforge.core.error.InternalSolverException;
import com.cadforge.core.error.InvalidConstraintException;
import com.cadforge.core.geometry.AnalyticGeometryEngine;
import com.cadforge.core.geometry.GeometryEngine;
import com.cadforge.core.geometry.Vector3;
import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.ConstraintStatus;
import com.cadforge.core.model.ConstraintType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Stateless constraint checks: validation, contradiction and DOF analysis
 * before a constraint enters a graph, and numeric evaluation against the
 * current geometry.
 * <p>
 * Evaluation is a tolerance check of closed-form measurements; the solver
 * never moves geometry to satisfy a constraint.
 */
@Component
public class ConstraintSolver {

    private static final Logger log = LoggerFactory.getLogger(ConstraintSolver.class);

    private final GeometryEngine geometry;
    private final double defaultTolerance;
    private final double angularTolerance;

    @Autowired
    public ConstraintSolver(GeometryEngine geometry, CadforgeProperties properties) {
        this(geometry, properties.getSolver().getDefaultTolerance(), properties.getSolver().getAngularTolerance());
    }

    public ConstraintSolver(GeometryEngine geometry, double defaultTolerance, double angularTolerance) {
        this.geometry = geometry;
        this.defaultTolerance = defaultTolerance;
        this.angularTolerance = angularTolerance;
    }

    public double defaultToleranceFor(ConstraintType type) {
        return type.isAngular() ? angularTolerance : defaultTolerance;
    }

    /**
     * Checks arity, entity kinds and parameters of a prospective constraint.
     *
     * @return the referenced entities in declaration order
     */
    public List<Entity> validate(ConstraintType type, List<String> entityIds,
                                 Map<String, Double> parameters, EntityLookup lookup) {
        if (entityIds == null || entityIds.isEmpty()) {
            throw new InvalidConstraintException(type.value() + " constraint needs at least one entity");
        }
        if (new HashSet<>(entityIds).size() != entityIds.size()) {
            throw new InvalidConstraintException("A constraint cannot reference the same entity twice",
                    Map.of("entity_ids", entityIds));
        }
        int arity = entityIds.size();
        boolean arityOk = switch (type) {
            case COINCIDENT, PARALLEL, PERPENDICULAR, TANGENT, ANGLE -> arity == 2;
            case DISTANCE -> arity == 1 || arity == 2;
            case RADIUS -> arity == 1;
        };
        if (!arityOk) {
            throw new InvalidConstraintException(type.value() + " constraint cannot take " + arity + " entities",
                    Map.of("constraint_type", type.value(), "entity_ids", entityIds));
        }

        List<Entity> entities = new ArrayList<>();
        for (String entityId : entityIds) {
            entities.add(lookup.require(entityId));
        }
        if (!typesCompatible(type, entities)) {
            throw new InvalidConstraintException(
                    type.value() + " constraint does not apply to " + entities.stream().map(e -> e.type().value()).toList(),
                    Map.of("constraint_type", type.value(),
                            "entity_types", entities.stream().map(e -> e.type().value()).toList()));
        }
        validateParameters(type, parameters);
        return entities;
    }

    /**
     * Adds {@code candidate} to {@code graph} if it neither contradicts an
     * existing constraint nor over-constrains its component. A constraint
     * equivalent to an existing one is stored as redundant, whether or not the
     * existing one is currently satisfied. On failure the graph
     * is left untouched.
     *
     * @throws ConstraintConflictException on contradiction or negative remaining DOF
     */
    public ApplyOutcome apply(ConstraintGraph graph, Constraint candidate, EntityLookup lookup) {
        validate(candidate.type(), candidate.entityIds(), candidate.parameters(), lookup);

        Optional<Constraint> equivalent = findEquivalent(graph, candidate);
        Constraint toStore;
        if (equivalent.isPresent()) {
            log.debug("Constraint {} duplicates {}, storing as redundant", candidate.id(), equivalent.get().id());
            toStore = evaluate(candidate.asRedundant(), lookup);
        } else {
            checkContradictions(graph, candidate);
            checkDegreesOfFreedom(graph, candidate, lookup);
            toStore = evaluate(candidate, lookup);
        }
        graph.add(toStore);

        Set<String> component = graph.component(toStore.entityIds());
        int total = totalDof(component, lookup);
        int removed = graph.dofRemovedWithin(component);
        return new ApplyOutcome(toStore, List.copyOf(new TreeSet<>(component)), total, removed, total - removed);
    }

    /**
     * Measures a constraint against current geometry. Redundant constraints keep
     * their status but get fresh measurements.
     */
    public Constraint evaluate(Constraint constraint, EntityLookup lookup) {
        List<Entity> entities = new ArrayList<>();
        for (String entityId : constraint.entityIds()) {
            entities.add(lookup.require(entityId));
        }
        Measurement measurement;
        try {
            Entity a = entities.get(0);
            Entity b = entities.size() > 1 ? entities.get(1) : null;
            measurement = switch (constraint.type()) {
                case COINCIDENT -> new Measurement(0, geometry.distance(a, b));
                case PARALLEL -> new Measurement(0, geometry.direction(a).cross(geometry.direction(b)).length());
                case PERPENDICULAR -> new Measurement(0, Math.abs(geometry.direction(a).dot(geometry.direction(b))));
                case TANGENT -> new Measurement(0, tangentResidual(a, b));
                case DISTANCE -> new Measurement(constraint.target(),
                        b == null ? geometry.evaluate(a).get("length") : geometry.distance(a, b));
                case ANGLE -> new Measurement(constraint.target(), geometry.angle(a, b));
                case RADIUS -> new Measurement(constraint.target(), a.param("r"));
            };
        } catch (ArithmeticException | IllegalArgumentException | IllegalStateException e) {
            throw new InternalSolverException("Failed to evaluate constraint " + constraint.id() + ": " + e.getMessage(), e);
        }
        double expected = measurement.expected();
        double actual = measurement.actual();

        ConstraintStatus status;
        if (constraint.status() == ConstraintStatus.REDUNDANT) {
            status = ConstraintStatus.REDUNDANT;
        } else {
            status = Math.abs(actual - expected) <= constraint.tolerance()
                    ? ConstraintStatus.SATISFIED
                    : ConstraintStatus.VIOLATED;
        }
        return constraint.withEvaluation(status, expected, actual);
    }

    /**
     * Re-evaluates every constraint in the components of the seed entities and
     * stores the results in the graph.
     *
     * @return the re-evaluated constraints
     */
    public List<Constraint> reevaluate(ConstraintGraph graph, Collection<String> seeds, EntityLookup lookup) {
        Set<String> component = graph.component(seeds);
        List<Constraint> evaluated = new ArrayList<>();
        for (Constraint constraint : graph.constraintsWithin(component)) {
            if (constraint.entityIds().stream().anyMatch(id -> lookup.find(id).isEmpty())) {
                log.warn("Skipping constraint {}: a referenced entity is no longer visible in '{}'",
                        constraint.id(), lookup.workspaceId());
                continue;
            }
            Constraint fresh = evaluate(constraint, lookup);
            graph.replace(fresh);
            evaluated.add(fresh);
        }
        return evaluated;
    }

    /**
     * DOF accounting per connected component of the given entities.
     */
    public List<ComponentDof> components(ConstraintGraph graph, Collection<String> entityIds, EntityLookup lookup) {
        List<ComponentDof> result = new ArrayList<>();
        for (Set<String> component : graph.components(entityIds)) {
            int total = totalDof(component, lookup);
            int removed = graph.dofRemovedWithin(component);
            result.add(new ComponentDof(List.copyOf(new TreeSet<>(component)), total, removed, total - removed));
        }
        return result;
    }

    public int totalDof(Collection<String> entityIds, EntityLookup lookup) {
        int total = 0;
        for (String entityId : entityIds) {
            Optional<Entity> entity = lookup.find(entityId);
            if (entity.isPresent()) {
                total += entity.get().type().degreesOfFreedom();
            }
        }
        return total;
    }

    /**
     * Whether two constraints express the same requirement on the same entities.
     */
    public boolean equivalent(Constraint existing, Constraint candidate) {
        if (existing.type() != candidate.type() || !existing.sameEntitySet(candidate)) {
            return false;
        }
        if (!candidate.type().isDimensional()) {
            return true;
        }
        return Math.abs(existing.target() - candidate.target()) <= candidate.tolerance();
    }

    private Optional<Constraint> findEquivalent(ConstraintGraph graph, Constraint candidate) {
        return graph.constraintsOn(candidate.entityIds().get(0)).stream()
                .filter(existing -> equivalent(existing, candidate))
                .findFirst();
    }

    private void checkContradictions(ConstraintGraph graph, Constraint candidate) {
        for (Constraint existing : graph.constraintsOn(candidate.entityIds().get(0))) {
            if (!existing.sameEntitySet(candidate)) {
                continue;
            }
            Optional<String> reason = contradiction(existing, candidate);
            if (reason.isPresent()) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("reason", "contradiction");
                details.put("constraint_type", candidate.type().value());
                details.put("entity_ids", candidate.entityIds());
                details.put("conflicting_constraint_id", existing.id());
                details.put("conflicting_constraint_type", existing.type().value());
                if (existing.type().isDimensional()) {
                    details.put("existing_target", existing.target());
                }
                if (candidate.type().isDimensional()) {
                    details.put("requested_target", candidate.target());
                }
                throw new ConstraintConflictException(reason.get(), details);
            }
        }
    }

    private Optional<String> contradiction(Constraint existing, Constraint candidate) {
        ConstraintType a = existing.type();
        ConstraintType b = candidate.type();
        double tolerance = candidate.tolerance();
        if (pair(a, b, ConstraintType.PARALLEL, ConstraintType.PERPENDICULAR)) {
            return Optional.of("Lines cannot be both parallel and perpendicular (conflicts with " + existing.id() + ")");
        }
        if (a == b && a.isDimensional() && Math.abs(existing.target() - candidate.target()) > tolerance) {
            return Optional.of("Conflicting " + a.value() + " targets " + existing.target() + " and "
                    + candidate.target() + " (conflicts with " + existing.id() + ")");
        }
        if (pair(a, b, ConstraintType.COINCIDENT, ConstraintType.DISTANCE)) {
            double distance = a == ConstraintType.DISTANCE ? existing.target() : candidate.target();
            if (distance > tolerance) {
                return Optional.of("Coincident points cannot be " + distance + " apart (conflicts with " + existing.id() + ")");
            }
        }
        if (pair(a, b, ConstraintType.PARALLEL, ConstraintType.ANGLE)) {
            double angle = a == ConstraintType.ANGLE ? existing.target() : candidate.target();
            if (angle > tolerance && Math.abs(Math.PI - angle) > tolerance) {
                return Optional.of("Parallel lines cannot meet at " + angle + " rad (conflicts with " + existing.id() + ")");
            }
        }
        if (pair(a, b, ConstraintType.PERPENDICULAR, ConstraintType.ANGLE)) {
            double angle = a == ConstraintType.ANGLE ? existing.target() : candidate.target();
            if (Math.abs(Math.PI / 2 - angle) > tolerance) {
                return Optional.of("Perpendicular lines cannot meet at " + angle + " rad (conflicts with " + existing.id() + ")");
            }
        }
        return Optional.empty();
    }

    private void checkDegreesOfFreedom(ConstraintGraph graph, Constraint candidate, EntityLookup lookup) {
        Set<String> component = graph.component(candidate.entityIds());
        int total = totalDof(component, lookup);
        int removed = graph.dofRemovedWithin(component);
        int remaining = total - removed - candidate.dofRemoved();
        if (remaining < 0) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "over_constrained");
            details.put("constraint_type", candidate.type().value());
            details.put("entity_ids", candidate.entityIds());
            details.put("component", List.copyOf(new TreeSet<>(component)));
            details.put("total_dof", total);
            details.put("dof_removed", removed);
            details.put("dof_requested", candidate.dofRemoved());
            details.put("dof_remaining", total - removed);
            throw new ConstraintConflictException(
                    "Over-constrained: component has " + (total - removed) + " DOF left, "
                            + candidate.type().value() + " removes " + candidate.dofRemoved(),
                    details);
        }
    }

    private double tangentResidual(Entity a, Entity b) {
        if (a.type() == EntityType.CIRCLE && b.type() == EntityType.CIRCLE) {
            double centers = AnalyticGeometryEngine.center(a).distanceTo(AnalyticGeometryEngine.center(b));
            double r1 = a.param("r");
            double r2 = b.param("r");
            return Math.min(Math.abs(centers - (r1 + r2)), Math.abs(centers - Math.abs(r1 - r2)));
        }
        Entity line = a.type() == EntityType.LINE ? a : b;
        Entity circle = a.type() == EntityType.CIRCLE ? a : b;
        Vector3 center = AnalyticGeometryEngine.center(circle);
        return Math.abs(geometry.distanceToLine(center, line) - circle.param("r"));
    }

    private static boolean typesCompatible(ConstraintType type, List<Entity> entities) {
        EntityType first = entities.get(0).type();
        EntityType second = entities.size() > 1 ? entities.get(1).type() : null;
        return switch (type) {
            case COINCIDENT -> first == EntityType.POINT && second == EntityType.POINT;
            case PARALLEL, PERPENDICULAR, ANGLE -> first == EntityType.LINE && second == EntityType.LINE;
            case TANGENT -> (first == EntityType.CIRCLE && (second == EntityType.LINE || second == EntityType.CIRCLE))
                    || (first == EntityType.LINE && second == EntityType.CIRCLE);
            case DISTANCE -> second == null
                    ? first == EntityType.LINE
                    : isMeasurable(first) && isMeasurable(second);
            case RADIUS -> first == EntityType.CIRCLE;
        };
    }

    private static boolean isMeasurable(EntityType type) {
        return type == EntityType.POINT || type == EntityType.LINE || type == EntityType.CIRCLE;
    }

    private static void validateParameters(ConstraintType type, Map<String, Double> parameters) {
        Map<String, Double> params = parameters != null ? parameters : Map.of();
        for (String key : params.keySet()) {
            if (!key.equals(type.parameterKey())) {
                throw new InvalidConstraintException("Unexpected parameter '" + key + "' for " + type.value(),
                        Map.of("constraint_type", type.value(), "parameter", key));
            }
        }
        if (!type.isDimensional()) {
            return;
        }
        Double value = params.get(type.parameterKey());
        if (value == null || !Double.isFinite(value)) {
            throw new InvalidConstraintException(type.value() + " constraint requires a finite '" + type.parameterKey() + "'",
                    Map.of("constraint_type", type.value(), "parameter", type.parameterKey()));
        }
        boolean inRange = switch (type) {
            case DISTANCE -> value >= 0;
            case ANGLE -> value >= 0 && value <= Math.PI;
            case RADIUS -> value > 0;
            case COINCIDENT, PARALLEL, PERPENDICULAR, TANGENT -> true;
        };
        if (!inRange) {
            throw new InvalidConstraintException(type.parameterKey() + " " + value + " is out of range for " + type.value(),
                    Map.of("constraint_type", type.value(), "parameter", type.parameterKey(), "value", value));
        }
    }

    private record Measurement(double expected, double actual) {}

    private static boolean pair(ConstraintType a, ConstraintType b, ConstraintType x, ConstraintType y) {
        return (a == x && b == y) || (a == y && b == x);
    }
}
