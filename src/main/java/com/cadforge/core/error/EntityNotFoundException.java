package com.cadforge.core.error;

import java.util.Map;

public class EntityNotFoundException extends CadforgeException {

    public EntityNotFoundException(String workspaceId, String entityId) {
        super(ErrorKind.ENTITY_NOT_FOUND,
                "Entity '" + entityId + "' not found in workspace '" + workspaceId + "'",
                Map.of("workspace_id", workspaceId, "entity_id", entityId));
    }
}
