package com.cadforge.dispatch.api;

import com.cadforge.core.model.Entity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON view of one entity version.
 */
public record EntityResponse(
    @JsonProperty("entity_id") String entityId,
    String type,
    Map<String, Double> parameters,
    long version,
    @JsonProperty("parent_ids") List<String> parentIds,
    @JsonProperty("created_by") String createdBy,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("modified_at") Instant modifiedAt
) {

    public static EntityResponse from(Entity entity) {
        return new EntityResponse(entity.id(), entity.type().value(), entity.parameters(), entity.version(),
                entity.parentIds(), entity.createdBy(), entity.createdAt(), entity.modifiedAt());
    }

    static EntityResponse fromNullable(Entity entity) {
        return entity != null ? from(entity) : null;
    }
}
