package com.cadforge.core.coordination;

import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.model.ResourceLock;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local lease store, used when no DataSource is configured.
 */
public class InMemoryLeaseLockStore implements LeaseLockStore {

    private final Map<LockKey, ResourceLock> locks = new ConcurrentHashMap<>();

    @Override
    public ResourceLock acquire(String resourceType, String resourceName, String holderId, String sessionId,
                                Instant now, Duration ttl) {
        var key = new LockKey(resourceType, resourceName);
        return locks.compute(key, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                return new ResourceLock(resourceType, resourceName, holderId, sessionId, now, now.plus(ttl));
            }
            if (!existing.isHeldBy(holderId)) {
                throw new AlreadyLockedException(existing);
            }
            return new ResourceLock(resourceType, resourceName, holderId,
                    sessionId != null ? sessionId : existing.sessionId(), existing.acquiredAt(), now.plus(ttl));
        });
    }

    @Override
    public boolean release(String resourceType, String resourceName, String holderId) {
        var released = new AtomicBoolean(false);
        locks.computeIfPresent(new LockKey(resourceType, resourceName), (k, existing) -> {
            if (existing.isHeldBy(holderId)) {
                released.set(true);
                return null;
            }
            return existing;
        });
        return released.get();
    }

    @Override
    public Optional<ResourceLock> find(String resourceType, String resourceName, Instant now) {
        return Optional.ofNullable(locks.get(new LockKey(resourceType, resourceName)))
                .filter(lock -> !lock.isExpired(now));
    }

    @Override
    public List<ResourceLock> list(Instant now) {
        return locks.values().stream()
                .filter(lock -> !lock.isExpired(now))
                .sorted(Comparator.comparing(ResourceLock::resourceType).thenComparing(ResourceLock::resourceName))
                .toList();
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = locks.size();
        locks.values().removeIf(lock -> lock.isExpired(now));
        return before - locks.size();
    }

    @Override
    public String describe() {
        return "in-memory lease store (" + locks.size() + " entries)";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private record LockKey(String resourceType, String resourceName) {}
}
