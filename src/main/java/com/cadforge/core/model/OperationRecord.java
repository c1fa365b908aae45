package com.cadforge.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One entry of a workspace's append-only operation log.
 *
 * @param sequence           1-based position in the workspace log
 * @param operationId        unique id of the operation
 * @param workspaceId        workspace the operation was applied to
 * @param type               kind of mutation
 * @param agentId            agent that issued it
 * @param timestamp          when it was applied
 * @param entityIds          entities the operation touched
 * @param entityChanges      entity snapshots before and after
 * @param constraintChanges  constraint snapshots before and after
 * @param revertsOperationId for {@link OperationType#UNDO}, the operation it reverted
 */
public record OperationRecord(
    long sequence,
    String operationId,
    String workspaceId,
    OperationType type,
    String agentId,
    Instant timestamp,
    List<String> entityIds,
    List<EntityChange> entityChanges,
    List<ConstraintChange> constraintChanges,
    String revertsOperationId
) implements Serializable {

    public OperationRecord {
        entityIds = List.copyOf(entityIds);
        entityChanges = List.copyOf(entityChanges);
        constraintChanges = List.copyOf(constraintChanges);
    }
}
