package com.cadforge.core.entity;

import com.cadforge.core.model.Entity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Versioned entity tables, one per workspace.
 * <p>
 * A table never overwrites history: each write appends a version stamped with
 * the workspace's operation sequence, and deletions append a tombstone. A
 * forked table stores only its own writes plus a link to its base table at a
 * base sequence; lookups fall through to the base when the entity has no
 * local version. Linking is O(1) regardless of model size.
 * <p>
 * Writers must hold the workspace lock; readers may run concurrently.
 */
@Component
public class EntityStore {

    private static final Logger log = LoggerFactory.getLogger(EntityStore.class);

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    public void createRoot(String workspaceId) {
        if (tables.putIfAbsent(workspaceId, new Table(null)) == null) {
            log.debug("Created root entity table '{}'", workspaceId);
        }
    }

    /**
     * Creates an empty table for {@code workspaceId} that sees {@code baseId} as of {@code baseSequence}.
     */
    public void fork(String workspaceId, String baseId, long baseSequence) {
        requireTable(baseId);
        Table table = new Table(baseId);
        table.links.add(new BaseLink(0, baseSequence));
        if (tables.putIfAbsent(workspaceId, table) != null) {
            throw new IllegalStateException("Entity table already exists for workspace " + workspaceId);
        }
        log.debug("Forked entity table '{}' from '{}' at sequence {}", workspaceId, baseId, baseSequence);
    }

    /**
     * Re-points a forked table at a newer base sequence from {@code ownSequence}
     * on. With {@code resetLocalVersions} every local version stops shadowing the
     * base from that sequence, so the table mirrors the base again.
     */
    public void rebase(String workspaceId, long ownSequence, long baseSequence, boolean resetLocalVersions) {
        Table table = requireTable(workspaceId);
        if (table.baseId == null) {
            throw new IllegalStateException("Root table " + workspaceId + " has no base to rebase onto");
        }
        if (resetLocalVersions) {
            for (var entry : table.versions.entrySet()) {
                entry.getValue().add(new EntityVersion(ownSequence, null, EntityVersion.Kind.INHERIT));
            }
        }
        table.links.add(new BaseLink(ownSequence, baseSequence));
        log.debug("Rebased entity table '{}' onto base sequence {} at own sequence {}",
                workspaceId, baseSequence, ownSequence);
    }

    public void put(String workspaceId, long sequence, Entity entity) {
        requireTable(workspaceId).versions
                .computeIfAbsent(entity.id(), id -> new CopyOnWriteArrayList<>())
                .add(new EntityVersion(sequence, entity, EntityVersion.Kind.VALUE));
    }

    public void tombstone(String workspaceId, long sequence, String entityId) {
        requireTable(workspaceId).versions
                .computeIfAbsent(entityId, id -> new CopyOnWriteArrayList<>())
                .add(new EntityVersion(sequence, null, EntityVersion.Kind.TOMBSTONE));
    }

    public Optional<Entity> find(String workspaceId, String entityId) {
        return find(workspaceId, entityId, Long.MAX_VALUE);
    }

    /**
     * The version of an entity visible in a workspace as of a sequence.
     */
    public Optional<Entity> find(String workspaceId, String entityId, long sequence) {
        Table table = requireTable(workspaceId);
        EntityVersion local = table.latest(entityId, sequence);
        if (local != null && local.kind() == EntityVersion.Kind.VALUE) {
            return Optional.of(local.entity());
        }
        if (local != null && local.kind() == EntityVersion.Kind.TOMBSTONE) {
            return Optional.empty();
        }
        if (table.baseId == null) {
            return Optional.empty();
        }
        return find(table.baseId, entityId, table.baseSequenceAt(sequence));
    }

    public Map<String, Entity> snapshot(String workspaceId) {
        return snapshot(workspaceId, Long.MAX_VALUE);
    }

    /**
     * Every entity visible in a workspace as of a sequence, keyed by id.
     */
    public Map<String, Entity> snapshot(String workspaceId, long sequence) {
        Table table = requireTable(workspaceId);
        Map<String, Entity> result = table.baseId != null
                ? snapshot(table.baseId, table.baseSequenceAt(sequence))
                : new TreeMap<>();
        for (String entityId : table.versions.keySet()) {
            EntityVersion local = table.latest(entityId, sequence);
            if (local == null) {
                continue;
            }
            switch (local.kind()) {
                case VALUE -> result.put(entityId, local.entity());
                case TOMBSTONE -> result.remove(entityId);
                case INHERIT -> {
                    // base content already in result
                }
            }
        }
        return result;
    }

    /**
     * Visible entities listing {@code parentId} among their parents.
     */
    public List<Entity> children(String workspaceId, String parentId) {
        List<Entity> children = new ArrayList<>();
        for (Entity entity : snapshot(workspaceId).values()) {
            if (entity.parentIds().contains(parentId)) {
                children.add(entity);
            }
        }
        return children;
    }

    public int count(String workspaceId) {
        return snapshot(workspaceId).size();
    }

    /**
     * Tables visible from a workspace, nearest first, each with the sequence it is seen at.
     */
    public List<LineagePoint> lineage(String workspaceId, long sequence) {
        List<LineagePoint> chain = new ArrayList<>();
        String current = workspaceId;
        long currentSequence = sequence;
        while (current != null) {
            Table table = requireTable(current);
            chain.add(new LineagePoint(current, currentSequence));
            if (table.baseId != null) {
                currentSequence = table.baseSequenceAt(currentSequence);
            }
            current = table.baseId;
        }
        return Collections.unmodifiableList(chain);
    }

    public boolean exists(String workspaceId) {
        return tables.containsKey(workspaceId);
    }

    public void drop(String workspaceId) {
        tables.remove(workspaceId);
    }

    private Table requireTable(String workspaceId) {
        Table table = tables.get(workspaceId);
        if (table == null) {
            throw new IllegalStateException("No entity table for workspace " + workspaceId);
        }
        return table;
    }

    private record BaseLink(long ownSequence, long baseSequence) {}

    private static final class Table {

        private final String baseId;
        private final List<BaseLink> links = new CopyOnWriteArrayList<>();
        private final Map<String, List<EntityVersion>> versions = new ConcurrentHashMap<>();

        private Table(String baseId) {
            this.baseId = baseId;
        }

        /** Latest local version at or before {@code sequence}; later appends win ties. */
        private EntityVersion latest(String entityId, long sequence) {
            List<EntityVersion> history = versions.get(entityId);
            if (history == null) {
                return null;
            }
            for (int i = history.size() - 1; i >= 0; i--) {
                EntityVersion version = history.get(i);
                if (version.sequence() <= sequence) {
                    return version;
                }
            }
            return null;
        }

        private long baseSequenceAt(long sequence) {
            long baseSequence = 0;
            for (BaseLink link : links) {
                if (link.ownSequence() <= sequence) {
                    baseSequence = link.baseSequence();
                }
            }
            return baseSequence;
        }
    }
}
