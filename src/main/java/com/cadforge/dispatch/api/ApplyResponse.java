package com.cadforge.dispatch.api;

import com.cadforge.core.constraint.ApplyOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of applying a constraint, with the DOF of its component afterwards.
 */
public record ApplyResponse(
    @JsonProperty("constraint_id") String constraintId,
    String status,
    @JsonProperty("dof_removed") int dofRemoved,
    List<String> component,
    @JsonProperty("total_dof") int totalDof,
    @JsonProperty("dof_remaining") int dofRemaining,
    ConstraintResponse constraint
) {

    public static ApplyResponse from(ApplyOutcome outcome) {
        return new ApplyResponse(outcome.constraint().id(), outcome.constraint().status().value(),
                outcome.constraint().dofRemoved(), outcome.component(), outcome.totalDof(),
                outcome.dofRemaining(), ConstraintResponse.from(outcome.constraint()));
    }
}
