package com.cadforge.dispatch.api;

import com.cadforge.core.model.MergeResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a merge. {@code conflicts} lists the conflicts that a strategy or
 * an explicit resolution settled.
 */
public record MergeResponse(
    @JsonProperty("source_workspace_id") String sourceWorkspaceId,
    @JsonProperty("target_workspace_id") String targetWorkspaceId,
    String strategy,
    @JsonProperty("entities_added") int entitiesAdded,
    @JsonProperty("entities_modified") int entitiesModified,
    @JsonProperty("entities_deleted") int entitiesDeleted,
    List<ConflictResponse> conflicts,
    @JsonProperty("constraints_added") List<String> constraintsAdded,
    @JsonProperty("constraints_removed") List<String> constraintsRemoved,
    @JsonProperty("constraints_reevaluated") List<String> constraintsReevaluated,
    @JsonProperty("operation_id") String operationId,
    @JsonProperty("target_sequence") long targetSequence
) {

    public static MergeResponse from(MergeResult result) {
        return new MergeResponse(result.sourceWorkspaceId(), result.targetWorkspaceId(), result.strategy().value(),
                result.entitiesAdded(), result.entitiesModified(), result.entitiesDeleted(),
                result.resolvedConflicts().stream().map(ConflictResponse::from).toList(),
                result.constraintsAdded(), result.constraintsRemoved(), result.constraintsReevaluated(),
                result.operationId(), result.targetSequence());
    }
}
