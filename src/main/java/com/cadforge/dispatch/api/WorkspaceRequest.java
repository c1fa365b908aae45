package com.cadforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/workspaces.
 *
 * @param name            workspace name, unique per agent
 * @param baseWorkspaceId workspace to fork from; nullable, defaults to the root
 */
public record WorkspaceRequest(
    String name,
    @JsonProperty("base_workspace_id") String baseWorkspaceId
) {}
