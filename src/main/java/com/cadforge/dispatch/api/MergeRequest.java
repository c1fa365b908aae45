package com.cadforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request body for POST /api/v1/workspaces/{workspaceId}/merge.
 *
 * @param targetWorkspaceId workspace receiving the changes; nullable, defaults to the source's base
 * @param strategy          auto, keep_source, keep_target or manual; nullable, defaults to auto
 * @param resolutions       explicit resolutions keyed by entity id; nullable
 */
public record MergeRequest(
    @JsonProperty("target_workspace_id") String targetWorkspaceId,
    String strategy,
    Map<String, ResolutionRequest> resolutions
) {

    /**
     * @param option     keep_source, keep_target or manual_merge
     * @param parameters merged parameters for manual_merge
     */
    public record ResolutionRequest(
        String option,
        Map<String, Double> parameters
    ) {}
}
