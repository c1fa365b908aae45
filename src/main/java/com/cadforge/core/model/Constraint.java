package com.cadforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A declared geometric relationship and its last evaluation.
 *
 * @param id         unique identifier, e.g. {@code constraint_9f8e7d6c}
 * @param type       relationship kind
 * @param entityIds  one or two referenced entity ids
 * @param parameters target values keyed by {@link ConstraintType#parameterKey()}
 * @param tolerance  absolute tolerance used when evaluating
 * @param status     last evaluation result
 * @param dofRemoved degrees of freedom this constraint removes (0 when redundant)
 * @param expected   target value of the measured quantity
 * @param actual     measured value at last evaluation
 * @param createdBy  declaring agent
 * @param createdAt  declaration time
 */
public record Constraint(
    String id,
    ConstraintType type,
    List<String> entityIds,
    Map<String, Double> parameters,
    double tolerance,
    ConstraintStatus status,
    int dofRemoved,
    double expected,
    double actual,
    String createdBy,
    Instant createdAt
) implements Serializable {

    public Constraint {
        entityIds = List.copyOf(entityIds);
        parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    public boolean references(String entityId) {
        return entityIds.contains(entityId);
    }

    public boolean sameEntitySet(Constraint other) {
        return new HashSet<>(entityIds).equals(new HashSet<>(other.entityIds));
    }

    /** Target value of a dimensional constraint, NaN for relational ones. */
    public double target() {
        if (!type.isDimensional()) {
            return Double.NaN;
        }
        Double value = parameters.get(type.parameterKey());
        return value != null ? value : Double.NaN;
    }

    public double residual() {
        return Math.abs(actual - expected);
    }

    public Constraint withEvaluation(ConstraintStatus newStatus, double newExpected, double newActual) {
        return new Constraint(id, type, entityIds, parameters, tolerance, newStatus, dofRemoved,
                newExpected, newActual, createdBy, createdAt);
    }

    public Constraint asRedundant() {
        return new Constraint(id, type, entityIds, parameters, tolerance, ConstraintStatus.REDUNDANT, 0,
                expected, actual, createdBy, createdAt);
    }
}
