package com.cadforge.dispatch.api;

import com.cadforge.core.model.Constraint;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON view of a constraint and its last evaluation. Measurements that are
 * not finite (no target on a relational constraint) are written as null.
 */
public record ConstraintResponse(
    @JsonProperty("constraint_id") String constraintId,
    @JsonProperty("constraint_type") String constraintType,
    @JsonProperty("entity_ids") List<String> entityIds,
    Map<String, Double> parameters,
    double tolerance,
    String status,
    @JsonProperty("dof_removed") int dofRemoved,
    Double expected,
    Double actual,
    Double residual,
    @JsonProperty("created_by") String createdBy
) {

    public static ConstraintResponse from(Constraint constraint) {
        return new ConstraintResponse(constraint.id(), constraint.type().value(), constraint.entityIds(),
                constraint.parameters(), constraint.tolerance(), constraint.status().value(),
                constraint.dofRemoved(), finite(constraint.expected()), finite(constraint.actual()),
                finite(constraint.residual()), constraint.createdBy());
    }

    private static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
