package com.cadforge.dispatch.api;

import com.cadforge.core.model.MergeConflict;
import com.cadforge.core.model.ResolutionOption;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One merge conflict with the three versions of the entity involved.
 */
public record ConflictResponse(
    @JsonProperty("entity_id") String entityId,
    @JsonProperty("conflict_type") String conflictType,
    @JsonProperty("conflicting_parameters") List<String> conflictingParameters,
    EntityResponse base,
    EntityResponse source,
    EntityResponse target,
    @JsonProperty("resolution_options") List<String> resolutionOptions
) {

    public static ConflictResponse from(MergeConflict conflict) {
        return new ConflictResponse(conflict.entityId(), conflict.type().value(), conflict.conflictingParameters(),
                EntityResponse.fromNullable(conflict.base()),
                EntityResponse.fromNullable(conflict.source()),
                EntityResponse.fromNullable(conflict.target()),
                conflict.resolutionOptions().stream().map(ResolutionOption::value).toList());
    }
}
