package com.cadforge.core.oplog;

import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.entity.EntityStore;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.logging.MdcContext;
import com.cadforge.core.metrics.CadforgeMetrics;
import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.OperationRecord;
import com.cadforge.core.model.OperationType;
import com.cadforge.core.workspace.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read access to a workspace's history and best-effort undo.
 * <p>
 * Undo writes the recorded {@code before} snapshots back as new versions and
 * reverses the recorded constraint changes. It does not replay later
 * operations, so constraints that depended on the undone state may end up
 * violated.
 */
@Service
public class HistoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    static final int MAX_PAGE = 500;

    private final OperationLog operationLog;
    private final EntityStore entityStore;
    private final WorkspaceRegistry registry;
    private final ConstraintService constraintService;
    private final CadforgeMetrics metrics;
    private final Clock clock;

    public HistoryService(OperationLog operationLog,
                          EntityStore entityStore,
                          WorkspaceRegistry registry,
                          ConstraintService constraintService,
                          CadforgeMetrics metrics,
                          Clock clock) {
        this.operationLog = operationLog;
        this.entityStore = entityStore;
        this.registry = registry;
        this.constraintService = constraintService;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * A page of records, newest first.
     */
    public List<OperationRecord> list(String workspaceId, int limit, int offset) {
        registry.require(workspaceId);
        if (limit < 1 || limit > MAX_PAGE) {
            throw new InvalidOperationException("limit must be between 1 and " + MAX_PAGE, Map.of("limit", limit));
        }
        if (offset < 0) {
            throw new InvalidOperationException("offset must not be negative", Map.of("offset", offset));
        }
        return operationLog.list(workspaceId, limit, offset);
    }

    /**
     * Reverts the most recent operation of a workspace that is neither an undo nor already undone.
     *
     * @throws InvalidOperationException when there is nothing to undo, or when reverting a creation
     *                                   would orphan entities created afterwards
     */
    public UndoResult undo(String workspaceId, String agentId) {
        registry.require(workspaceId);
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidOperationException("An agent id is required");
        }
        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "history.undo");
            try {
                OperationRecord reverted = operationLog.latestUndoable(workspaceId)
                        .orElseThrow(() -> new InvalidOperationException(
                                "Nothing to undo in workspace '" + workspaceId + "'", Map.of("workspace_id", workspaceId)));
                checkNoOrphans(workspaceId, reverted);
                return revert(workspaceId, agentId, reverted);
            } finally {
                MdcContext.clear();
            }
        });
    }

    private UndoResult revert(String workspaceId, String agentId, OperationRecord reverted) {
        Instant now = clock.instant();
        long sequence = operationLog.nextSequence(workspaceId);
        List<EntityChange> entityChanges = new ArrayList<>();
        List<ConstraintChange> constraintChanges = new ArrayList<>();
        List<String> restoredConstraints = new ArrayList<>();
        List<String> removedConstraints = new ArrayList<>();

        // constraints the operation introduced or rewrote go first
        for (ConstraintChange change : reverse(reverted.constraintChanges())) {
            if (change.after() != null) {
                constraintService.discard(workspaceId, change.constraintId()).ifPresent(current -> {
                    constraintChanges.add(new ConstraintChange(current.id(), current, null));
                    removedConstraints.add(current.id());
                });
            }
        }

        Set<String> touched = new LinkedHashSet<>();
        for (EntityChange change : reverse(reverted.entityChanges())) {
            Optional<Entity> current = entityStore.find(workspaceId, change.entityId());
            Entity before = change.before();
            touched.add(change.entityId());
            if (before == null) {
                if (current.isPresent()) {
                    entityStore.tombstone(workspaceId, sequence, change.entityId());
                    for (ConstraintChange removed : constraintService.removeForEntity(workspaceId, change.entityId())) {
                        constraintChanges.add(removed);
                        removedConstraints.add(removed.constraintId());
                    }
                    entityChanges.add(new EntityChange(change.entityId(), current.get(), null));
                }
                continue;
            }
            long version = before.version();
            if (change.after() != null) {
                version = Math.max(version, change.after().version());
            }
            if (current.isPresent()) {
                version = Math.max(version, current.get().version());
            }
            Entity restored = before.withVersion(version + 1, now);
            entityStore.put(workspaceId, sequence, restored);
            entityChanges.add(new EntityChange(change.entityId(), current.orElse(null), restored));
        }

        for (ConstraintChange change : reverse(reverted.constraintChanges())) {
            Constraint before = change.before();
            if (before == null) {
                continue;
            }
            if (constraintService.restore(workspaceId, before)) {
                constraintChanges.add(new ConstraintChange(before.id(), null, before));
                restoredConstraints.add(before.id());
            } else {
                log.debug("Constraint {} not restored: already present or an entity is gone", before.id());
            }
        }

        OperationRecord undo = operationLog.append(workspaceId, OperationType.UNDO, agentId,
                reverted.entityIds(), entityChanges, constraintChanges, reverted.operationId());

        Set<String> seeds = new LinkedHashSet<>();
        for (String id : touched) {
            if (entityStore.find(workspaceId, id).isPresent()) {
                seeds.add(id);
            }
        }
        for (ConstraintChange change : constraintChanges) {
            Constraint constraint = change.after() != null ? change.after() : change.before();
            constraint.entityIds().stream()
                    .filter(id -> entityStore.find(workspaceId, id).isPresent())
                    .forEach(seeds::add);
        }
        List<String> reevaluated = constraintService.reevaluate(workspaceId, seeds).stream()
                .map(Constraint::id)
                .toList();

        metrics.recordUndo(reverted.type().name());
        log.info("Undid {} {} in '{}' as {}", reverted.type(), reverted.operationId(), workspaceId, undo.operationId());
        return new UndoResult(undo.operationId(), reverted.operationId(), reverted.type(),
                List.copyOf(touched), restoredConstraints, removedConstraints, reevaluated);
    }

    /**
     * Refuses to revert a creation whose entity has since gained children.
     */
    private void checkNoOrphans(String workspaceId, OperationRecord reverted) {
        Set<String> removing = new LinkedHashSet<>();
        for (EntityChange change : reverted.entityChanges()) {
            if (change.before() == null) {
                removing.add(change.entityId());
            }
        }
        for (String entityId : removing) {
            List<String> children = entityStore.children(workspaceId, entityId).stream()
                    .map(Entity::id)
                    .filter(id -> !removing.contains(id))
                    .toList();
            if (!children.isEmpty()) {
                throw new InvalidOperationException(
                        "Cannot undo " + reverted.operationId() + ": '" + entityId + "' now has children",
                        Map.of("operation_id", reverted.operationId(), "entity_id", entityId, "child_ids", children));
            }
        }
    }

    private static <T> List<T> reverse(List<T> items) {
        List<T> reversed = new ArrayList<>(items);
        Collections.reverse(reversed);
        return reversed;
    }
}
