package com.cadforge.dispatch.api;

import com.cadforge.core.workspace.WorkspaceStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;

/**
 * A workspace with its branch status and counters.
 */
public record WorkspaceStatusResponse(
    @JsonUnwrapped WorkspaceResponse workspace,
    String status,
    @JsonProperty("entity_count") int entityCount,
    @JsonProperty("constraint_count") int constraintCount,
    @JsonProperty("operation_count") long operationCount,
    @JsonProperty("local_operations") long localOperations,
    @JsonProperty("base_head") long baseHead,
    @JsonProperty("can_merge") boolean canMerge,
    @JsonProperty("created_at") Instant createdAt
) {

    public static WorkspaceStatusResponse from(WorkspaceStatus status) {
        return new WorkspaceStatusResponse(WorkspaceResponse.from(status.workspace()), status.status().value(),
                status.entityCount(), status.constraintCount(), status.operationCount(),
                status.localOperations(), status.baseHead(), status.canMerge(), status.workspace().createdAt());
    }
}
