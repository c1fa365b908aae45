package com.cadforge.dispatch.api;

import com.cadforge.core.constraint.PropagationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PropagationResponse(
    List<String> component,
    List<ConstraintResponse> reevaluated,
    @JsonProperty("violated_count") long violatedCount
) {

    public static PropagationResponse from(PropagationResult result) {
        return new PropagationResponse(result.component(),
                result.reevaluated().stream().map(ConstraintResponse::from).toList(),
                result.violatedCount());
    }
}
