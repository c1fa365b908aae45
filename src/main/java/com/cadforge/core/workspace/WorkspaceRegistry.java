package com.cadforge.core.workspace;

import com.cadforge.core.error.WorkspaceNotFoundException;
import com.cadforge.core.model.Workspace;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Workspace metadata and the per-workspace mutation locks. Every call names its
 * workspace explicitly; there is no current workspace.
 */
@Component
public class WorkspaceRegistry {

    private final Map<String, Workspace> workspaces = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public void register(Workspace workspace) {
        if (workspaces.putIfAbsent(workspace.id(), workspace) != null) {
            throw new IllegalStateException("Workspace already registered: " + workspace.id());
        }
    }

    public void update(Workspace workspace) {
        workspaces.put(workspace.id(), workspace);
    }

    public void remove(String workspaceId) {
        workspaces.remove(workspaceId);
        locks.remove(workspaceId);
    }

    public Optional<Workspace> find(String workspaceId) {
        return workspaceId == null ? Optional.empty() : Optional.ofNullable(workspaces.get(workspaceId));
    }

    public Workspace require(String workspaceId) {
        return find(workspaceId).orElseThrow(() -> new WorkspaceNotFoundException(String.valueOf(workspaceId)));
    }

    public boolean exists(String workspaceId) {
        return workspaceId != null && workspaces.containsKey(workspaceId);
    }

    public List<Workspace> all() {
        return workspaces.values().stream()
                .sorted(Comparator.comparing(Workspace::createdAt).thenComparing(Workspace::id))
                .toList();
    }

    /** Workspaces forked directly from {@code workspaceId}. */
    public List<Workspace> branchesOf(String workspaceId) {
        return workspaces.values().stream()
                .filter(w -> workspaceId.equals(w.baseWorkspaceId()))
                .toList();
    }

    /**
     * Runs {@code action} holding the mutation lock of one workspace.
     */
    public <T> T locked(String workspaceId, Supplier<T> action) {
        ReentrantLock lock = lockFor(workspaceId);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the locks of two workspaces, taken in id order.
     */
    public <T> T locked(String first, String second, Supplier<T> action) {
        String low = first.compareTo(second) <= 0 ? first : second;
        String high = low.equals(first) ? second : first;
        return locked(low, () -> locked(high, action));
    }

    private ReentrantLock lockFor(String workspaceId) {
        return locks.computeIfAbsent(workspaceId, id -> new ReentrantLock());
    }
}
