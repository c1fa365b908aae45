package com.cadforge.core.constraint;

import com.cadforge.core.model.Constraint;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Constraints of one workspace as a graph: entity ids are nodes, constraints
 * are edges. Connected components are the unit of DOF accounting and of
 * incremental re-evaluation.
 * <p>
 * Not thread-safe; callers hold the workspace lock.
 */
public class ConstraintGraph {

    private final Map<String, Constraint> constraints = new LinkedHashMap<>();
    private final Map<String, Set<String>> incidence = new HashMap<>();
    private final Set<String> retired = new HashSet<>();
    private final Map<String, Long> ordinals = new HashMap<>();
    private long nextOrdinal;

    public ConstraintGraph copy() {
        ConstraintGraph copy = new ConstraintGraph();
        constraints.values().forEach(copy::add);
        copy.retired.addAll(retired);
        return copy;
    }

    public void add(Constraint constraint) {
        if (constraints.putIfAbsent(constraint.id(), constraint) != null) {
            throw new IllegalStateException("Constraint already present: " + constraint.id());
        }
        ordinals.put(constraint.id(), nextOrdinal++);
        for (String entityId : constraint.entityIds()) {
            incidence.computeIfAbsent(entityId, id -> new LinkedHashSet<>()).add(constraint.id());
        }
    }

    /**
     * Replaces the stored evaluation of an existing constraint.
     */
    public void replace(Constraint constraint) {
        if (!constraints.containsKey(constraint.id())) {
            throw new IllegalStateException("Unknown constraint: " + constraint.id());
        }
        constraints.put(constraint.id(), constraint);
    }

    public Optional<Constraint> remove(String constraintId) {
        Constraint removed = constraints.remove(constraintId);
        if (removed == null) {
            return Optional.empty();
        }
        ordinals.remove(constraintId);
        for (String entityId : removed.entityIds()) {
            Set<String> ids = incidence.get(entityId);
            if (ids != null) {
                ids.remove(constraintId);
                if (ids.isEmpty()) {
                    incidence.remove(entityId);
                }
            }
        }
        retired.add(constraintId);
        return Optional.of(removed);
    }

    /**
     * Removes every constraint referencing the entity.
     */
    public List<Constraint> removeForEntity(String entityId) {
        List<Constraint> removed = new ArrayList<>();
        for (String id : List.copyOf(incidence.getOrDefault(entityId, Set.of()))) {
            remove(id).ifPresent(removed::add);
        }
        return removed;
    }

    /**
     * Puts back a previously removed constraint.
     */
    public void restore(Constraint constraint) {
        retired.remove(constraint.id());
        add(constraint);
    }

    public Optional<Constraint> get(String constraintId) {
        return Optional.ofNullable(constraints.get(constraintId));
    }

    public boolean contains(String constraintId) {
        return constraints.containsKey(constraintId);
    }

    /** Whether the constraint was present once and has been removed. */
    public boolean isRetired(String constraintId) {
        return retired.contains(constraintId);
    }

    public Set<String> retiredIds() {
        return Set.copyOf(retired);
    }

    public List<Constraint> all() {
        return List.copyOf(constraints.values());
    }

    public int size() {
        return constraints.size();
    }

    public List<Constraint> constraintsOn(String entityId) {
        List<Constraint> result = new ArrayList<>();
        for (String id : incidence.getOrDefault(entityId, Set.of())) {
            result.add(constraints.get(id));
        }
        return result;
    }

    /**
     * Entity ids connected to any of the seeds through constraints. Seeds are
     * always part of the result, even when unconstrained.
     */
    public Set<String> component(Collection<String> seeds) {
        Set<String> visited = new LinkedHashSet<>(seeds);
        Deque<String> queue = new ArrayDeque<>(seeds);
        while (!queue.isEmpty()) {
            String entityId = queue.poll();
            for (String constraintId : incidence.getOrDefault(entityId, Set.of())) {
                for (String neighbour : constraints.get(constraintId).entityIds()) {
                    if (visited.add(neighbour)) {
                        queue.add(neighbour);
                    }
                }
            }
        }
        return visited;
    }

    /**
     * Splits entity ids into connected components.
     */
    public List<Set<String>> components(Collection<String> entityIds) {
        List<Set<String>> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String entityId : entityIds) {
            if (seen.contains(entityId)) {
                continue;
            }
            Set<String> component = component(List.of(entityId));
            seen.addAll(component);
            result.add(component);
        }
        return result;
    }

    /**
     * Constraints touching any of the given entities, in declaration order.
     * Only the incidence sets of those entities are visited.
     */
    public List<Constraint> constraintsWithin(Set<String> entityIds) {
        Set<String> ids = new LinkedHashSet<>();
        for (String entityId : entityIds) {
            ids.addAll(incidence.getOrDefault(entityId, Set.of()));
        }
        List<Constraint> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            result.add(constraints.get(id));
        }
        result.sort(Comparator.comparingLong(constraint -> ordinals.get(constraint.id())));
        return result;
    }

    public int dofRemovedWithin(Set<String> entityIds) {
        int removed = 0;
        for (Constraint constraint : constraintsWithin(entityIds)) {
            removed += constraint.dofRemoved();
        }
        return removed;
    }
}
