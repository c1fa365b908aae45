package com.cadforge.dispatch.api;

import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.OperationRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * One operation log entry without its before/after snapshots.
 */
public record OperationResponse(
    long sequence,
    @JsonProperty("operation_id") String operationId,
    @JsonProperty("workspace_id") String workspaceId,
    @JsonProperty("operation_type") String operationType,
    @JsonProperty("agent_id") String agentId,
    Instant timestamp,
    @JsonProperty("entity_ids") List<String> entityIds,
    @JsonProperty("constraint_ids") List<String> constraintIds,
    @JsonProperty("reverts_operation_id") String revertsOperationId
) {

    public static OperationResponse from(OperationRecord record) {
        return new OperationResponse(record.sequence(), record.operationId(), record.workspaceId(),
                record.type().value(), record.agentId(), record.timestamp(), record.entityIds(),
                record.constraintChanges().stream().map(ConstraintChange::constraintId).distinct().toList(),
                record.revertsOperationId());
    }
}
