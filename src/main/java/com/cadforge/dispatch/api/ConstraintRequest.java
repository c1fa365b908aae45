package com.cadforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/workspaces/{workspaceId}/constraints.
 *
 * @param constraintType coincident, parallel, perpendicular, tangent, distance, angle or radius
 * @param entityIds      one or two entity ids
 * @param parameters     distance, angle (radians) or radius target; nullable for relational constraints
 * @param tolerance      absolute tolerance; nullable, defaults per constraint type
 */
public record ConstraintRequest(
    @JsonProperty("constraint_type") String constraintType,
    @JsonProperty("entity_ids") List<String> entityIds,
    Map<String, Double> parameters,
    Double tolerance
) {}
