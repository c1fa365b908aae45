package com.cadforge.dispatch.api;

import com.cadforge.core.entity.EntityDeletion;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EntityDeletionResponse(
    @JsonProperty("entity_id") String entityId,
    boolean deleted,
    @JsonProperty("removed_constraint_ids") List<String> removedConstraintIds
) {

    public static EntityDeletionResponse from(EntityDeletion deletion) {
        return new EntityDeletionResponse(deletion.entityId(), true, deletion.removedConstraintIds());
    }
}
