package com.cadforge.core.constraint;

import com.cadforge.core.model.Constraint;

import java.util.List;

/**
 * Constraint status for a workspace or one sketch of it.
 *
 * @param workspaceId  workspace inspected
 * @param sketchId     sketch the report is limited to, null for the whole workspace
 * @param satisfied    satisfied constraints in scope
 * @param violated     violated constraints in scope
 * @param redundant    redundant constraints in scope
 * @param totalDof     degrees of freedom of the entities in scope and their components
 * @param dofRemoved   degrees of freedom removed by the constraints in scope
 * @param dofRemaining {@code totalDof - dofRemoved}
 * @param components   per-component breakdown
 * @param constraints  constraints in scope with expected and actual values
 */
public record ConstraintReport(
    String workspaceId,
    String sketchId,
    int satisfied,
    int violated,
    int redundant,
    int totalDof,
    int dofRemoved,
    int dofRemaining,
    List<ComponentDof> components,
    List<Constraint> constraints
) {}
