package com.cadforge.dispatch.api;

import com.cadforge.core.model.ResourceLock;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.time.Instant;
import java.util.Optional;

public record LockResponse(
    @JsonProperty("resource_type") String resourceType,
    @JsonProperty("resource_name") String resourceName,
    String holder,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("acquired_at") Instant acquiredAt,
    @JsonProperty("expires_at") Instant expiresAt
) {

    public static LockResponse from(ResourceLock lock) {
        return new LockResponse(lock.resourceType(), lock.resourceName(), lock.holderId(), lock.sessionId(),
                lock.acquiredAt(), lock.expiresAt());
    }

    /**
     * Granted lease, flattened after a {@code granted} flag.
     */
    public record Granted(boolean granted, @JsonUnwrapped LockResponse lock) {

        public static Granted from(ResourceLock lock) {
            return new Granted(true, LockResponse.from(lock));
        }
    }

    /**
     * Whether a resource is leased; the lease fields follow when it is.
     */
    public record Status(boolean locked, @JsonUnwrapped LockResponse lock) {

        public static Status of(Optional<ResourceLock> lock) {
            return lock.map(held -> new Status(true, LockResponse.from(held)))
                    .orElseGet(() -> new Status(false, null));
        }
    }

    public record Released(boolean released) {}
}
