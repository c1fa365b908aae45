package com.cadforge.dispatch.api;

import java.util.Map;

/**
 * Request body for PATCH on an entity. Only the given parameters change.
 */
public record EntityUpdateRequest(
    Map<String, Double> parameters
) {}
