package com.cadforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of a successful merge.
 *
 * @param sourceWorkspaceId       workspace whose changes were merged
 * @param targetWorkspaceId       workspace that received them
 * @param strategy                strategy used
 * @param entitiesAdded           entities created in the target
 * @param entitiesModified        entities whose target version changed
 * @param entitiesDeleted         entities tombstoned in the target
 * @param resolvedConflicts       conflicts settled by a strategy or an explicit resolution
 * @param constraintsAdded        source constraints carried into the target
 * @param constraintsRemoved      target constraints dropped by the merge
 * @param constraintsReevaluated  constraints re-evaluated in affected components
 * @param operationId             id of the MERGE record in the target log, null when nothing changed
 * @param targetSequence          target log head after the merge
 */
public record MergeResult(
    String sourceWorkspaceId,
    String targetWorkspaceId,
    MergeStrategy strategy,
    int entitiesAdded,
    int entitiesModified,
    int entitiesDeleted,
    List<MergeConflict> resolvedConflicts,
    List<String> constraintsAdded,
    List<String> constraintsRemoved,
    List<String> constraintsReevaluated,
    String operationId,
    long targetSequence
) implements Serializable {

    public MergeResult {
        resolvedConflicts = List.copyOf(resolvedConflicts);
        constraintsAdded = List.copyOf(constraintsAdded);
        constraintsRemoved = List.copyOf(constraintsRemoved);
        constraintsReevaluated = List.copyOf(constraintsReevaluated);
    }
}
