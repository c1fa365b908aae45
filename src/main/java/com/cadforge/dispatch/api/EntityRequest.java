package com.cadforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/v1/workspaces/{workspaceId}/entities.
 *
 * @param type       entity type (point, line, circle, sketch, solid)
 * @param parameters geometric parameters; optional ones default to 0
 * @param parentIds  parent entities, e.g. the sketch a point belongs to; nullable
 */
public record EntityRequest(
    String type,
    Map<String, Double> parameters,
    @JsonProperty("parent_ids") List<String> parentIds
) {}
