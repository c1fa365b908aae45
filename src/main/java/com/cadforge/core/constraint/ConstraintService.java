package com.cadforge.core.constraint;

import com.cadforge.core.entity.EntityStore;
import com.cadforge.core.error.ConstraintConflictException;
import com.cadforge.core.error.InvalidConstraintException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.logging.MdcContext;
import com.cadforge.core.metrics.CadforgeMetrics;
import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.ConstraintStatus;
import com.cadforge.core.model.ConstraintType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.OperationType;
import com.cadforge.core.oplog.OperationLog;
import com.cadforge.core.workspace.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the constraint graph of every workspace and exposes constraint
 * application, removal, status reporting and incremental propagation.
 */
@Service
public class ConstraintService {

    private static final Logger log = LoggerFactory.getLogger(ConstraintService.class);

    private final Map<String, ConstraintGraph> graphs = new ConcurrentHashMap<>();

    private final EntityStore entityStore;
    private final OperationLog operationLog;
    private final WorkspaceRegistry registry;
    private final ConstraintSolver solver;
    private final CadforgeMetrics metrics;
    private final Clock clock;

    public ConstraintService(EntityStore entityStore,
                             OperationLog operationLog,
                             WorkspaceRegistry registry,
                             ConstraintSolver solver,
                             CadforgeMetrics metrics,
                             Clock clock) {
        this.entityStore = entityStore;
        this.operationLog = operationLog;
        this.registry = registry;
        this.solver = solver;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Declares a constraint in a workspace.
     *
     * @param tolerance absolute tolerance, or null for the configured default of the constraint type
     * @throws ConstraintConflictException when the constraint contradicts another or over-constrains its component
     */
    public ApplyOutcome apply(String workspaceId, ConstraintType type, List<String> entityIds,
                              Map<String, Double> parameters, Double tolerance, String agentId) {
        registry.require(workspaceId);
        if (tolerance != null && (!Double.isFinite(tolerance) || tolerance <= 0)) {
            throw new InvalidConstraintException("Tolerance must be a positive number", Map.of("tolerance", tolerance));
        }
        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "constraint.apply");
            try {
                ConstraintGraph graph = graph(workspaceId);
                var candidate = new Constraint(
                        "constraint_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8),
                        type,
                        entityIds == null ? List.of() : entityIds,
                        parameters == null ? Map.of() : parameters,
                        tolerance != null ? tolerance : solver.defaultToleranceFor(type),
                        ConstraintStatus.SATISFIED,
                        type.dofRemoved(),
                        Double.NaN,
                        Double.NaN,
                        agentId,
                        clock.instant());

                ApplyOutcome outcome;
                try {
                    outcome = solver.apply(graph, candidate, lookup(workspaceId));
                } catch (ConstraintConflictException e) {
                    metrics.recordConstraintConflict(String.valueOf(e.details().get("reason")));
                    log.info("Rejected {} constraint on {}: {}", type.value(), entityIds, e.getMessage());
                    throw e;
                }

                Constraint stored = outcome.constraint();
                operationLog.append(workspaceId, OperationType.CONSTRAINT_APPLY, agentId, stored.entityIds(),
                        List.of(), List.of(new ConstraintChange(stored.id(), null, stored)), null);
                metrics.recordConstraintApplied(type.value(), stored.status().name());
                log.info("Applied {} constraint {} on {} -> {} ({} DOF remaining in component)",
                        type.value(), stored.id(), stored.entityIds(), stored.status(), outcome.dofRemaining());
                return outcome;
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Removes a constraint. An equivalent redundant constraint, if any, takes
     * over the removed one's DOF.
     *
     * @return the removed constraint
     */
    public Constraint remove(String workspaceId, String constraintId, String agentId) {
        registry.require(workspaceId);
        return registry.locked(workspaceId, () -> {
            MdcContext.setOperation(workspaceId, agentId, "constraint.remove");
            try {
                ConstraintGraph graph = graph(workspaceId);
                Constraint removed = graph.remove(constraintId).orElseThrow(() -> new InvalidOperationException(
                        "Constraint '" + constraintId + "' not found in workspace '" + workspaceId + "'",
                        Map.of("workspace_id", workspaceId, "constraint_id", constraintId)));

                List<ConstraintChange> changes = new ArrayList<>();
                changes.add(new ConstraintChange(removed.id(), removed, null));
                if (removed.status() != ConstraintStatus.REDUNDANT) {
                    promoteRedundant(graph, removed).ifPresent(changes::add);
                }
                solver.reevaluate(graph, removed.entityIds(), lookup(workspaceId));

                operationLog.append(workspaceId, OperationType.CONSTRAINT_REMOVE, agentId, removed.entityIds(),
                        List.of(), changes, null);
                log.info("Removed constraint {} ({}) from '{}'", removed.id(), removed.type().value(), workspaceId);
                return removed;
            } finally {
                MdcContext.clear();
            }
        });
    }

    /**
     * Constraint status of a whole workspace, or of one sketch when {@code sketchId} is given.
     * A sketch's scope is its child entities plus everything constrained to them.
     */
    public ConstraintReport status(String workspaceId, String sketchId) {
        registry.require(workspaceId);
        return registry.locked(workspaceId, () -> {
            ConstraintGraph graph = graph(workspaceId);
            EntityLookup lookup = lookup(workspaceId);

            Set<String> scope = new LinkedHashSet<>();
            if (sketchId == null) {
                scope.addAll(entityStore.snapshot(workspaceId).keySet());
            } else {
                Entity sketch = lookup.require(sketchId);
                if (sketch.type() != EntityType.SKETCH) {
                    throw new InvalidOperationException("Entity '" + sketchId + "' is a " + sketch.type().value() + ", not a sketch",
                            Map.of("entity_id", sketchId));
                }
                entityStore.children(workspaceId, sketchId).forEach(child -> scope.add(child.id()));
            }

            Set<String> closure = graph.component(scope);
            List<Constraint> inScope = graph.constraintsWithin(closure);
            int satisfied = 0;
            int violated = 0;
            int redundant = 0;
            for (Constraint constraint : inScope) {
                switch (constraint.status()) {
                    case SATISFIED -> satisfied++;
                    case VIOLATED -> violated++;
                    case REDUNDANT -> redundant++;
                }
            }
            int total = solver.totalDof(closure, lookup);
            int removed = graph.dofRemovedWithin(closure);
            return new ConstraintReport(workspaceId, sketchId, satisfied, violated, redundant,
                    total, removed, total - removed,
                    solver.components(graph, closure, lookup), inScope);
        });
    }

    /**
     * Re-evaluates only the constraints in the connected component of a changed entity.
     */
    public PropagationResult propagate(String workspaceId, String entityId) {
        return registry.locked(workspaceId, () -> {
            long start = System.nanoTime();
            ConstraintGraph graph = graph(workspaceId);
            Set<String> component = graph.component(List.of(entityId));
            List<Constraint> evaluated = solver.reevaluate(graph, List.of(entityId), lookup(workspaceId));
            metrics.recordPropagation(evaluated.size(), System.nanoTime() - start);
            var result = new PropagationResult(entityId, List.copyOf(new TreeSet<>(component)), evaluated);
            if (result.violatedCount() > 0) {
                log.info("Propagation from {} left {} violated constraint(s)", entityId, result.violatedCount());
            }
            return result;
        });
    }

    /**
     * Re-evaluates the components of several entities; used after merges and undo.
     */
    public List<Constraint> reevaluate(String workspaceId, Collection<String> entityIds) {
        return registry.locked(workspaceId,
                () -> solver.reevaluate(graph(workspaceId), entityIds, lookup(workspaceId)));
    }

    public List<Constraint> constraintsOn(String workspaceId, String entityId) {
        return registry.locked(workspaceId, () -> graph(workspaceId).constraintsOn(entityId));
    }

    public Optional<Constraint> find(String workspaceId, String constraintId) {
        return registry.locked(workspaceId, () -> graph(workspaceId).get(constraintId));
    }

    /**
     * Removes every constraint referencing an entity; the caller holds the workspace lock
     * and records the returned changes.
     */
    public List<ConstraintChange> removeForEntity(String workspaceId, String entityId) {
        List<ConstraintChange> changes = new ArrayList<>();
        for (Constraint removed : graph(workspaceId).removeForEntity(entityId)) {
            changes.add(new ConstraintChange(removed.id(), removed, null));
        }
        return changes;
    }

    /**
     * Puts back a removed constraint if all its entities are still visible.
     *
     * @return whether the constraint was restored
     */
    public boolean restore(String workspaceId, Constraint constraint) {
        ConstraintGraph graph = graph(workspaceId);
        EntityLookup lookup = lookup(workspaceId);
        if (graph.contains(constraint.id())
                || constraint.entityIds().stream().anyMatch(id -> lookup.find(id).isEmpty())) {
            return false;
        }
        graph.restore(constraint);
        return true;
    }

    /**
     * Drops a constraint without logging; the caller records the change.
     */
    public Optional<Constraint> discard(String workspaceId, String constraintId) {
        return graph(workspaceId).remove(constraintId);
    }

    // --- graph lifecycle, driven by the workspace manager ---

    public void initialize(String workspaceId) {
        graphs.putIfAbsent(workspaceId, new ConstraintGraph());
    }

    /**
     * Seeds a new workspace with a copy of its base's constraints.
     */
    public void fork(String baseId, String workspaceId) {
        graphs.put(workspaceId, graph(baseId).copy());
    }

    /** Working copy of a workspace graph, for tentative changes. */
    public ConstraintGraph copyOf(String workspaceId) {
        return graph(workspaceId).copy();
    }

    public void install(String workspaceId, ConstraintGraph graph) {
        graphs.put(workspaceId, graph);
    }

    public void drop(String workspaceId) {
        graphs.remove(workspaceId);
    }

    public int count(String workspaceId) {
        return graph(workspaceId).size();
    }

    public ConstraintSolver solver() {
        return solver;
    }

    public EntityLookup lookup(String workspaceId) {
        return EntityLookup.of(workspaceId, entityStore);
    }

    private Optional<ConstraintChange> promoteRedundant(ConstraintGraph graph, Constraint removed) {
        for (Constraint candidate : graph.constraintsOn(removed.entityIds().get(0))) {
            if (candidate.status() == ConstraintStatus.REDUNDANT && solver.equivalent(candidate, removed)) {
                var promoted = new Constraint(candidate.id(), candidate.type(), candidate.entityIds(),
                        candidate.parameters(), candidate.tolerance(), ConstraintStatus.SATISFIED,
                        candidate.type().dofRemoved(), candidate.expected(), candidate.actual(),
                        candidate.createdBy(), candidate.createdAt());
                graph.replace(promoted);
                log.debug("Promoted redundant constraint {} after removing {}", candidate.id(), removed.id());
                return Optional.of(new ConstraintChange(candidate.id(), candidate, promoted));
            }
        }
        return Optional.empty();
    }

    private ConstraintGraph graph(String workspaceId) {
        ConstraintGraph graph = graphs.get(workspaceId);
        if (graph == null) {
            throw new IllegalStateException("No constraint graph for workspace " + workspaceId);
        }
        return graph;
    }
}
