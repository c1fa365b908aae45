package com.cadforge.dispatch.api;

import com.cadforge.core.entity.EntityUpdate;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

public record EntityUpdateResponse(
    @JsonUnwrapped EntityResponse entity,
    PropagationResponse propagation
) {

    public static EntityUpdateResponse from(EntityUpdate update) {
        return new EntityUpdateResponse(EntityResponse.from(update.entity()),
                PropagationResponse.from(update.propagation()));
    }
}
