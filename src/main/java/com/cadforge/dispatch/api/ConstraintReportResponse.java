package com.cadforge.dispatch.api;

import com.cadforge.core.constraint.ComponentDof;
import com.cadforge.core.constraint.ConstraintReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Constraint status of a workspace or sketch, per-constraint detail included.
 */
public record ConstraintReportResponse(
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("sketch_id") String sketchId,
    Counts counts,
    @JsonProperty("total_dof") int totalDof,
    @JsonProperty("dof_removed") int dofRemoved,
    @JsonProperty("dof_remaining") int dofRemaining,
    List<ComponentResponse> components,
    List<ConstraintResponse> constraints
) {

    public static ConstraintReportResponse from(ConstraintReport report) {
        return new ConstraintReportResponse(report.workspaceId(), report.sketchId(),
                new Counts(report.satisfied(), report.violated(), report.redundant()),
                report.totalDof(), report.dofRemoved(), report.dofRemaining(),
                report.components().stream().map(ComponentResponse::from).toList(),
                report.constraints().stream().map(ConstraintResponse::from).toList());
    }

    public record Counts(int satisfied, int violated, int redundant) {}

    public record ComponentResponse(
        @JsonProperty("entity_ids") List<String> entityIds,
        @JsonProperty("total_dof") int totalDof,
        @JsonProperty("dof_removed") int dofRemoved,
        @JsonProperty("dof_remaining") int dofRemaining
    ) {

        static ComponentResponse from(ComponentDof component) {
            return new ComponentResponse(component.entityIds(), component.totalDof(),
                    component.dofRemoved(), component.dofRemaining());
        }
    }
}
