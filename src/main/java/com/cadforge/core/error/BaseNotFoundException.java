package com.cadforge.core.error;

import java.util.Map;

public class BaseNotFoundException extends CadforgeException {

    public BaseNotFoundException(String workspaceId) {
        super(ErrorKind.BASE_NOT_FOUND, "Workspace '" + workspaceId + "' does not exist",
                Map.of("workspace_id", workspaceId));
    }
}
