package com.cadforge.core.constraint;

import com.cadforge.core.model.Constraint;

import java.util.List;

/**
 * Result of adding one constraint to a graph.
 *
 * @param constraint   the stored constraint with its evaluation
 * @param component    entity ids of the connected component it joined
 * @param totalDof     degrees of freedom of the component's entities
 * @param dofRemoved   degrees of freedom removed by all constraints of the component
 * @param dofRemaining {@code totalDof - dofRemoved}, never negative
 */
public record ApplyOutcome(
    Constraint constraint,
    List<String> component,
    int totalDof,
    int dofRemoved,
    int dofRemaining
) {}
