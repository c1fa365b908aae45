package com.cadforge.core.entity;

import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.constraint.PropagationResult;
import com.cadforge.core.error.EntityNotFoundException;
import com.cadforge.core.error.InvalidEntityException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.geometry.GeometryEngine;
import com.cadforge.core.logging.MdcContext;
import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.OperationType;
import com.cadforge.core.oplog.OperationLog;
import com.cadforge.core.workspace.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entity lifecycle within a workspace. Every mutation writes a new version to
 * the {@link EntityStore}, appends one operation record and, for updates,
 * re-evaluates the constraints connected to the entity.
 */
@Service
public class EntityService {

    private static final Logger log = LoggerFactory.getLogger(EntityService.class);

    private final EntityStore entityStore;
    private final OperationLog operationLog;
    private final WorkspaceRegistry registry;
    private final ConstraintService constraintService;
    private final GeometryEngine geometry;
    private final Clock clock;

    public EntityService(EntityStore entityStore,
                         OperationLog operationLog,
                         WorkspaceRegistry registry,
                         ConstraintService constraintService,
                         GeometryEngine geometry,
                         Clock clock) {
        this.entityStore = entityStore;
        this.operationLog = operationLog;
        this.registry = registry;
        this.constraintService = constraintService;
        this.geometry = geometry;
        this.clock = clock;
    }

    public Entity create(String workspaceId, EntityType type, Map<String, Double> parameters,
                         List<String> parentIds, String agentId) {
        registry.require(workspaceId);
        requireAgent(agentId);
        Map<String, Double> normalized = EntityParameters.normalize(type, parameters);
        List<String> parents = parentIds == null ? List.of() : List.copyOf(parentIds);

        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "entity.create");
            try {
                validateParents(workspaceId, type, parents);
                Instant now = clock.instant();
                String id = workspaceId + ":" + type.value() + "_"
                        + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
                var entity = new Entity(id, type, normalized, 1, parents, agentId, now, now);

                long sequence = operationLog.nextSequence(workspaceId);
                entityStore.put(workspaceId, sequence, entity);
                operationLog.append(workspaceId, OperationType.ENTITY_CREATE, agentId, List.of(id),
                        List.of(new EntityChange(id, null, entity)), List.of(), null);
                log.info("Created {} {} in '{}'", type.value(), id, workspaceId);
                return entity;
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Merges {@code parameters} into the entity's current parameters, writes a
     * new version and re-evaluates its constraint component.
     */
    public EntityUpdate update(String workspaceId, String entityId, Map<String, Double> parameters, String agentId) {
        registry.require(workspaceId);
        requireAgent(agentId);
        if (parameters == null || parameters.isEmpty()) {
            throw new InvalidEntityException("Update needs at least one parameter", Map.of("entity_id", entityId));
        }
        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "entity.update");
            try {
                Entity current = require(workspaceId, entityId);
                Map<String, Double> merged = new HashMap<>(current.parameters());
                merged.putAll(parameters);
                Entity updated = current.withParameters(EntityParameters.normalize(current.type(), merged), clock.instant());

                long sequence = operationLog.nextSequence(workspaceId);
                entityStore.put(workspaceId, sequence, updated);
                operationLog.append(workspaceId, OperationType.ENTITY_UPDATE, agentId, List.of(entityId),
                        List.of(new EntityChange(entityId, current, updated)), List.of(), null);
                log.info("Updated {} to version {}", entityId, updated.version());

                PropagationResult propagation = constraintService.propagate(workspaceId, entityId);
                return new EntityUpdate(updated, propagation);
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Tombstones an entity and removes every constraint referencing it.
     * Entities that still have visible children cannot be deleted.
     */
    public EntityDeletion delete(String workspaceId, String entityId, String agentId) {
        registry.require(workspaceId);
        requireAgent(agentId);
        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "entity.delete");
            try {
                Entity current = require(workspaceId, entityId);
                List<Entity> children = entityStore.children(workspaceId, entityId);
                if (!children.isEmpty()) {
                    throw new InvalidEntityException("Entity '" + entityId + "' still has " + children.size() + " child(ren)",
                            Map.of("entity_id", entityId, "child_ids", children.stream().map(Entity::id).toList()));
                }

                long sequence = operationLog.nextSequence(workspaceId);
                entityStore.tombstone(workspaceId, sequence, entityId);
                List<ConstraintChange> removed = constraintService.removeForEntity(workspaceId, entityId);
                operationLog.append(workspaceId, OperationType.ENTITY_DELETE, agentId, List.of(entityId),
                        List.of(new EntityChange(entityId, current, null)), removed, null);
                List<String> removedIds = removed.stream().map(ConstraintChange::constraintId).toList();
                log.info("Deleted {} from '{}' (removed constraints: {})", entityId, workspaceId, removedIds);
                return new EntityDeletion(entityId, removedIds);
            } finally {
                MdcContext.clear();
            }
        });
    }

    public EntityDetails query(String workspaceId, String entityId) {
        registry.require(workspaceId);
        Entity entity = require(workspaceId, entityId);
        return new EntityDetails(
                entity,
                geometry.evaluate(entity),
                entityStore.children(workspaceId, entityId).stream().map(Entity::id).toList(),
                constraintService.constraintsOn(workspaceId, entityId));
    }

    /**
     * Visible entities of a workspace, optionally filtered by type, ordered by id.
     */
    public List<Entity> list(String workspaceId, EntityType type) {
        registry.require(workspaceId);
        return entityStore.snapshot(workspaceId).values().stream()
                .filter(entity -> type == null || entity.type() == type)
                .toList();
    }

    private Entity require(String workspaceId, String entityId) {
        return entityStore.find(workspaceId, entityId)
                .orElseThrow(() -> new EntityNotFoundException(workspaceId, entityId));
    }

    private void validateParents(String workspaceId, EntityType type, List<String> parentIds) {
        if (type == EntityType.SOLID && parentIds.size() != 1) {
            throw new InvalidEntityException("A solid needs exactly one parent sketch",
                    Map.of("parent_ids", parentIds));
        }
        for (String parentId : parentIds) {
            Entity parent = require(workspaceId, parentId);
            boolean allowed = switch (type) {
                case POINT, LINE, CIRCLE, SOLID -> parent.type() == EntityType.SKETCH;
                case SKETCH -> true;
            };
            if (!allowed) {
                throw new InvalidEntityException(
                        "A " + type.value() + " cannot belong to a " + parent.type().value(),
                        Map.of("parent_id", parentId, "parent_type", parent.type().value()));
            }
        }
    }

    private static void requireAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidOperationException("An agent id is required");
        }
    }
}
