package com.cadforge.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/locks.
 */
public record LockRequest(
    @JsonProperty("resource_type") String resourceType,
    @JsonProperty("resource_name") String resourceName,
    String holder,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("ttl_seconds") Long ttlSeconds
) {}
