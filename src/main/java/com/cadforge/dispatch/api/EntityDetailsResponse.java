package com.cadforge.dispatch.api;

import com.cadforge.core.entity.EntityDetails;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Map;

/**
 * An entity with its derived properties, children and constraints.
 */
public record EntityDetailsResponse(
    @JsonUnwrapped EntityResponse entity,
    Map<String, Double> properties,
    @JsonProperty("child_ids") List<String> childIds,
    List<ConstraintResponse> constraints
) {

    public static EntityDetailsResponse from(EntityDetails details) {
        return new EntityDetailsResponse(EntityResponse.from(details.entity()), details.properties(),
                details.childIds(), details.constraints().stream().map(ConstraintResponse::from).toList());
    }
}
