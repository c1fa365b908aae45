package com.cadforge.core.coordination;

import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.model.ResourceLock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for resource leases. Expiry is checked on access: an expired lease
 * is deleted or ignored by the next call that touches it, never by a timer.
 */
public interface LeaseLockStore {

    /**
     * Grants or renews a lease.
     *
     * @throws AlreadyLockedException if another holder has an unexpired lease on the resource
     */
    ResourceLock acquire(String resourceType, String resourceName, String holderId, String sessionId,
                         Instant now, Duration ttl);

    /**
     * Releases a lease held by {@code holderId}. A missing lease or one held by
     * someone else is left alone.
     *
     * @return whether a lease was released
     */
    boolean release(String resourceType, String resourceName, String holderId);

    Optional<ResourceLock> find(String resourceType, String resourceName, Instant now);

    List<ResourceLock> list(Instant now);

    /** Deletes expired leases, returning how many were removed. */
    int purgeExpired(Instant now);

    /** Short description for health output. */
    String describe();

    boolean isAvailable();
}
