package com.cadforge.core.constraint;

import com.cadforge.core.entity.EntityStore;
import com.cadforge.core.error.EntityNotFoundException;
import com.cadforge.core.model.Entity;

import java.util.Map;
import java.util.Optional;

/**
 * Read access to the entities a constraint graph refers to. Backed either by a
 * workspace's live view or by a tentative merged view.
 */
public interface EntityLookup {

    String workspaceId();

    Optional<Entity> find(String entityId);

    default Entity require(String entityId) {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(workspaceId(), entityId));
    }

    static EntityLookup of(String workspaceId, Map<String, Entity> entities) {
        return new EntityLookup() {
            @Override
            public String workspaceId() {
                return workspaceId;
            }

            @Override
            public Optional<Entity> find(String entityId) {
                return Optional.ofNullable(entities.get(entityId));
            }
        };
    }

    static EntityLookup of(String workspaceId, EntityStore store) {
        return new EntityLookup() {
            @Override
            public String workspaceId() {
                return workspaceId;
            }

            @Override
            public Optional<Entity> find(String entityId) {
                return store.find(workspaceId, entityId);
            }
        };
    }
}
