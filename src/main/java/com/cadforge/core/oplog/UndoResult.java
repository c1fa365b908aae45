package com.cadforge.core.oplog;

import com.cadforge.core.model.OperationType;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of an undo.
 *
 * @param operationId            id of the appended UNDO record
 * @param revertedOperationId    operation that was reverted
 * @param revertedType           type of the reverted operation
 * @param entityIds              entities written back
 * @param constraintsRestored    constraints put back into the graph
 * @param constraintsRemoved     constraints taken out of the graph
 * @param constraintsReevaluated constraints re-evaluated afterwards
 */
public record UndoResult(
    String operationId,
    String revertedOperationId,
    OperationType revertedType,
    List<String> entityIds,
    List<String> constraintsRestored,
    List<String> constraintsRemoved,
    List<String> constraintsReevaluated
) implements Serializable {

    public UndoResult {
        entityIds = List.copyOf(entityIds);
        constraintsRestored = List.copyOf(constraintsRestored);
        constraintsRemoved = List.copyOf(constraintsRemoved);
        constraintsReevaluated = List.copyOf(constraintsReevaluated);
    }
}
