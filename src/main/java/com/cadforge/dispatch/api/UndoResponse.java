package com.cadforge.dispatch.api;

import com.cadforge.core.oplog.UndoResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record UndoResponse(
    @JsonProperty("operation_id") String operationId,
    @JsonProperty("reverted_operation_id") String revertedOperationId,
    @JsonProperty("reverted_operation_type") String revertedOperationType,
    @JsonProperty("entity_ids") List<String> entityIds,
    @JsonProperty("constraints_restored") List<String> constraintsRestored,
    @JsonProperty("constraints_removed") List<String> constraintsRemoved,
    @JsonProperty("constraints_reevaluated") List<String> constraintsReevaluated
) {

    public static UndoResponse from(UndoResult result) {
        return new UndoResponse(result.operationId(), result.revertedOperationId(), result.revertedType().value(),
                result.entityIds(), result.constraintsRestored(), result.constraintsRemoved(),
                result.constraintsReevaluated());
    }
}
