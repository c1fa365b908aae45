package com.cadforge.core.coordination;

import com.cadforge.core.config.CadforgeProperties;
import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.metrics.CadforgeMetrics;
import com.cadforge.core.model.ResourceLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lease locks on named resources shared between agents.
 */
@Service
public class LeaseLockService {

    private static final Logger log = LoggerFactory.getLogger(LeaseLockService.class);

    private final LeaseLockStore store;
    private final Clock clock;
    private final CadforgeProperties properties;
    private final CadforgeMetrics metrics;

    public LeaseLockService(LeaseLockStore store, Clock clock, CadforgeProperties properties, CadforgeMetrics metrics) {
        this.store = store;
        this.clock = clock;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Acquires or renews a lease.
     *
     * @param ttlSeconds lease duration, or null for the configured default
     * @throws AlreadyLockedException if another holder has an unexpired lease
     */
    public ResourceLock acquire(String resourceType, String resourceName, String holderId,
                                String sessionId, Long ttlSeconds) {
        requireText("resource_type", resourceType);
        requireText("resource_name", resourceName);
        requireText("holder", holderId);
        long ttl = ttlSeconds != null ? ttlSeconds : properties.getLocks().getDefaultTtlSeconds();
        long maxTtl = properties.getLocks().getMaxTtlSeconds();
        if (ttl <= 0 || ttl > maxTtl) {
            throw new InvalidOperationException("ttl_seconds must be between 1 and " + maxTtl,
                    Map.of("ttl_seconds", ttl));
        }

        try {
            ResourceLock lock = store.acquire(resourceType, resourceName, holderId, sessionId,
                    clock.instant(), Duration.ofSeconds(ttl));
            metrics.recordLockAcquire(resourceType, true);
            log.debug("Lease {}/{} granted to '{}' until {}", resourceType, resourceName, holderId, lock.expiresAt());
            return lock;
        } catch (AlreadyLockedException e) {
            metrics.recordLockAcquire(resourceType, false);
            log.info("Lease {}/{} denied to '{}': held by '{}' until {}", resourceType, resourceName, holderId,
                    e.heldLock().holderId(), e.heldLock().expiresAt());
            throw e;
        }
    }

    /**
     * Releases a lease. Idempotent: releasing a missing or foreign lease is a no-op.
     */
    public boolean release(String resourceType, String resourceName, String holderId) {
        requireText("resource_type", resourceType);
        requireText("resource_name", resourceName);
        requireText("holder", holderId);
        boolean released = store.release(resourceType, resourceName, holderId);
        if (released) {
            log.debug("Lease {}/{} released by '{}'", resourceType, resourceName, holderId);
        }
        return released;
    }

    public Optional<ResourceLock> status(String resourceType, String resourceName) {
        return store.find(resourceType, resourceName, clock.instant());
    }

    public List<ResourceLock> list() {
        return store.list(clock.instant());
    }

    public int purgeExpired() {
        return store.purgeExpired(clock.instant());
    }

    /**
     * Runs {@code action} while holding a lease, releasing it afterwards. A lease
     * the holder already had before the call is renewed and left in place.
     */
    public <T> T withLock(String resourceType, String resourceName, String holderId, String sessionId,
                          Duration ttl, Supplier<T> action) {
        boolean alreadyHeld = status(resourceType, resourceName)
                .map(lock -> lock.isHeldBy(holderId))
                .orElse(false);
        acquire(resourceType, resourceName, holderId, sessionId, Math.max(1, ttl.toSeconds()));
        try {
            return action.get();
        } finally {
            if (!alreadyHeld) {
                release(resourceType, resourceName, holderId);
            }
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidOperationException(field + " is required");
        }
    }
}
