package com.cadforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A lease on a named shared resource.
 *
 * @param resourceType category of the resource, e.g. {@code workspace} or {@code global_constraints}
 * @param resourceName name within the category
 * @param holderId     agent holding the lease
 * @param sessionId    optional execution/session id of the holder
 * @param acquiredAt   first acquisition time
 * @param expiresAt    time after which the lease is treated as absent
 */
public record ResourceLock(
    String resourceType,
    String resourceName,
    String holderId,
    String sessionId,
    Instant acquiredAt,
    Instant expiresAt
) implements Serializable {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String agentId) {
        return holderId.equals(agentId);
    }
}
