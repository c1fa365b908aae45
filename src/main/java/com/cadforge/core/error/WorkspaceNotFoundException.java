package com.cadforge.core.error;

import java.util.Map;

public class WorkspaceNotFoundException extends CadforgeException {

    public WorkspaceNotFoundException(String workspaceId) {
        super(ErrorKind.WORKSPACE_NOT_FOUND, "Workspace '" + workspaceId + "' not found",
                Map.of("workspace_id", workspaceId));
    }
}
