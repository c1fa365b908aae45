package com.cadforge.dispatch.api;

import com.cadforge.core.model.Workspace;
import com.fasterxml.jackson.annotation.JsonProperty;

public record WorkspaceResponse(
    @JsonProperty("workspace_id") String workspaceId,
    String name,
    @JsonProperty("base_workspace_id") String baseWorkspaceId,
    @JsonProperty("divergence_point") long divergencePoint,
    @JsonProperty("owner_agent_id") String ownerAgentId
) {

    public static WorkspaceResponse from(Workspace workspace) {
        return new WorkspaceResponse(workspace.id(), workspace.name(), workspace.baseWorkspaceId(),
                workspace.divergencePoint(), workspace.ownerAgentId());
    }

    public record Deleted(@JsonProperty("workspace_id") String workspaceId, boolean deleted) {

        public static Deleted from(Workspace workspace) {
            return new Deleted(workspace.id(), true);
        }
    }
}
