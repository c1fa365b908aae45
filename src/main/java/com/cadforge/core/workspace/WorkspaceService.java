package com.cadforge.core.workspace;

import com.cadforge.core.config.CadforgeProperties;
import com.cadforge.core.constraint.ApplyOutcome;
import com.cadforge.core.constraint.ConstraintGraph;
import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.constraint.ConstraintSolver;
import com.cadforge.core.constraint.EntityLookup;
import com.cadforge.core.coordination.LeaseLockService;
import com.cadforge.core.entity.EntityStore;
import com.cadforge.core.entity.LineagePoint;
import com.cadforge.core.error.BaseNotFoundException;
import com.cadforge.core.error.CadforgeException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.error.WorkspaceConflictException;
import com.cadforge.core.logging.MdcContext;
import com.cadforge.core.metrics.CadforgeMetrics;
import com.cadforge.core.model.BranchStatus;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.ConstraintChange;
import com.cadforge.core.model.ConstraintStatus;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.MergeResult;
import com.cadforge.core.model.MergeStrategy;
import com.cadforge.core.model.OperationRecord;
import com.cadforge.core.model.OperationType;
import com.cadforge.core.model.Workspace;
import com.cadforge.core.oplog.OperationLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Workspace lifecycle and merging.
 * <p>
 * A branch starts as an O(1) fork of its base's entity table plus a copy of
 * the base's constraints. Merges are three-way against the nearest common
 * ancestor and are all-or-nothing: conflicts, over-constraint or a
 * contradicting carried constraint abort before the target changes.
 */
@Service
public class WorkspaceService {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9_.-]+");
    static final String LOCK_RESOURCE_TYPE = "workspace";

    private final WorkspaceRegistry registry;
    private final EntityStore entityStore;
    private final OperationLog operationLog;
    private final ConstraintService constraintService;
    private final MergeEngine mergeEngine;
    private final LeaseLockService leaseLockService;
    private final CadforgeProperties properties;
    private final CadforgeMetrics metrics;
    private final Clock clock;

    public WorkspaceService(WorkspaceRegistry registry,
                            EntityStore entityStore,
                            OperationLog operationLog,
                            ConstraintService constraintService,
                            MergeEngine mergeEngine,
                            LeaseLockService leaseLockService,
                            CadforgeProperties properties,
                            CadforgeMetrics metrics,
                            Clock clock) {
        this.registry = registry;
        this.entityStore = entityStore;
        this.operationLog = operationLog;
        this.constraintService = constraintService;
        this.mergeEngine = mergeEngine;
        this.leaseLockService = leaseLockService;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        initializeRoot();
    }

    public String rootId() {
        return properties.getWorkspace().getRootId();
    }

    /**
     * Forks a new workspace {@code <agent>:<name>} from {@code baseId} (the root when null).
     */
    public Workspace create(String name, String baseId, String agentId) {
        requireAgent(agentId);
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new InvalidOperationException("Workspace name must match " + NAME_PATTERN.pattern(),
                    Map.of("workspace_name", String.valueOf(name)));
        }
        String base = baseId == null || baseId.isBlank() ? rootId() : baseId;
        if (!registry.exists(base)) {
            throw new BaseNotFoundException(base);
        }
        String id = agentId + ":" + name;

        return registry.locked(base, () -> {
            // the base may have been deleted while this call waited for its lock
            if (!registry.exists(base)) {
                throw new BaseNotFoundException(base);
            }
            if (registry.exists(id)) {
                throw new InvalidOperationException("Workspace '" + id + "' already exists", Map.of("workspace_id", id));
            }
            long divergence = operationLog.head(base);
            entityStore.fork(id, base, divergence);
            constraintService.fork(base, id);
            operationLog.register(id);
            var workspace = new Workspace(id, name, base, divergence, 0, agentId, clock.instant(), false);
            registry.register(workspace);
            log.info("Created workspace '{}' from '{}' at sequence {}", id, base, divergence);
            return workspace;
        });
    }

    public WorkspaceStatus status(String workspaceId) {
        Workspace workspace = registry.require(workspaceId);
        long head = operationLog.head(workspaceId);
        BranchStatus status = workspace.statusAt(head);
        boolean baseAlive = !workspace.isRoot() && registry.exists(workspace.baseWorkspaceId());
        long baseHead = baseAlive ? operationLog.head(workspace.baseWorkspaceId()) : 0;
        return new WorkspaceStatus(
                workspace,
                status,
                entityStore.count(workspaceId),
                constraintService.count(workspaceId),
                head,
                head - workspace.syncedSequence(),
                baseHead,
                baseAlive && status != BranchStatus.MERGED);
    }

    public List<WorkspaceStatus> list() {
        return registry.all().stream().map(w -> status(w.id())).toList();
    }

    /**
     * Removes a branch. Only its owner may delete it, never the root, and never
     * while other workspaces are forked from it.
     */
    public Workspace delete(String workspaceId, String agentId) {
        requireAgent(agentId);
        Workspace workspace = registry.require(workspaceId);
        if (workspace.isRoot()) {
            throw new InvalidOperationException("The root workspace cannot be deleted", Map.of("workspace_id", workspaceId));
        }
        if (!workspace.ownerAgentId().equals(agentId)) {
            throw new InvalidOperationException("Only owner '" + workspace.ownerAgentId() + "' may delete '" + workspaceId + "'",
                    Map.of("workspace_id", workspaceId, "owner_agent_id", workspace.ownerAgentId()));
        }
        registry.locked(workspaceId, () -> {
            registry.require(workspaceId);
            List<Workspace> branches = registry.branchesOf(workspaceId);
            if (!branches.isEmpty()) {
                throw new InvalidOperationException("Workspace '" + workspaceId + "' still has branches",
                        Map.of("workspace_id", workspaceId, "branch_ids", branches.stream().map(Workspace::id).toList()));
            }
            registry.remove(workspaceId);
            entityStore.drop(workspaceId);
            operationLog.drop(workspaceId);
            constraintService.drop(workspaceId);
            return workspace;
        });
        log.info("Deleted workspace '{}'", workspaceId);
        return workspace;
    }

    /**
     * Merges {@code sourceId} into {@code targetId}.
     *
     * @param resolutions explicit conflict resolutions keyed by entity id; may be empty
     * @throws WorkspaceConflictException when conflicts remain unresolved; the target is untouched
     */
    public MergeResult merge(String sourceId, String targetId, MergeStrategy strategy,
                             Map<String, ConflictResolution> resolutions, String agentId) {
        requireAgent(agentId);
        MergeStrategy effective = strategy != null ? strategy : MergeStrategy.AUTO;
        if (sourceId == null || sourceId.equals(targetId)) {
            throw new InvalidOperationException("Cannot merge a workspace into itself",
                    Map.of("workspace_id", String.valueOf(sourceId)));
        }
        if (!registry.exists(sourceId)) {
            throw new BaseNotFoundException(sourceId);
        }
        if (!registry.exists(targetId)) {
            throw new BaseNotFoundException(String.valueOf(targetId));
        }

        Duration ttl = Duration.ofSeconds(properties.getWorkspace().getMergeLockTtlSeconds());
        MdcContext.setOperation(targetId, agentId, "workspace.merge");
        try {
            MergeResult result = leaseLockService.withLock(LOCK_RESOURCE_TYPE, targetId, agentId, "merge:" + sourceId, ttl,
                    () -> registry.locked(sourceId, targetId,
                            () -> doMerge(sourceId, targetId, effective,
                                    resolutions == null ? Map.of() : resolutions, agentId)));
            metrics.recordMerge(effective.value(), "merged");
            return result;
        } catch (WorkspaceConflictException e) {
            metrics.recordMerge(effective.value(), "conflict");
            throw e;
        } catch (CadforgeException e) {
            metrics.recordMerge(effective.value(), "rejected");
            log.info("Merge of '{}' into '{}' rejected: {}", sourceId, targetId, e.getMessage());
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private MergeResult doMerge(String sourceId, String targetId, MergeStrategy strategy,
                                Map<String, ConflictResolution> resolutions, String agentId) {
        Workspace source = registry.require(sourceId);
        Workspace target = registry.require(targetId);
        long sourceHead = operationLog.head(sourceId);
        long targetHead = operationLog.head(targetId);
        if (source.statusAt(sourceHead) == BranchStatus.MERGED) {
            throw new InvalidOperationException("Workspace '" + sourceId + "' is already merged and has no new operations",
                    Map.of("workspace_id", sourceId));
        }

        LineagePoint mergeBase = mergeBase(sourceId, sourceHead, targetId, targetHead);
        Map<String, Entity> base = entityStore.snapshot(mergeBase.workspaceId(), mergeBase.sequence());
        Map<String, Entity> sourceView = entityStore.snapshot(sourceId, sourceHead);
        Map<String, Entity> targetView = entityStore.snapshot(targetId, targetHead);
        log.debug("Merging '{}' into '{}' against {}@{}", sourceId, targetId,
                mergeBase.workspaceId(), mergeBase.sequence());

        MergePlan plan = mergeEngine.plan(base, sourceView, targetView, strategy, resolutions, clock.instant());
        metrics.recordMergeConflicts(plan.resolved().size() + plan.unresolved().size());
        if (plan.hasConflicts()) {
            log.info("Merge of '{}' into '{}' found {} unresolved conflict(s)", sourceId, targetId, plan.unresolved().size());
            throw new WorkspaceConflictException(sourceId, targetId, plan.unresolved());
        }

        Map<String, Entity> merged = new TreeMap<>(targetView);
        Set<String> changedIds = new LinkedHashSet<>();
        for (EntityChange change : plan.changes()) {
            changedIds.add(change.entityId());
            if (change.after() == null) {
                merged.remove(change.entityId());
            } else {
                merged.put(change.entityId(), change.after());
            }
        }
        checkParents(merged, targetId);

        // constraints: build the merged graph on a copy so a rejection leaves the target untouched
        EntityLookup mergedLookup = EntityLookup.of(targetId, merged);
        ConstraintSolver solver = constraintService.solver();
        ConstraintGraph sourceGraph = constraintService.copyOf(sourceId);
        ConstraintGraph graph = constraintService.copyOf(targetId);
        List<ConstraintChange> constraintChanges = new ArrayList<>();
        List<String> removedConstraints = new ArrayList<>();
        List<String> addedConstraints = new ArrayList<>();

        for (String retiredId : sourceGraph.retiredIds()) {
            graph.remove(retiredId).ifPresent(removed -> {
                constraintChanges.add(new ConstraintChange(removed.id(), removed, null));
                removedConstraints.add(removed.id());
            });
        }
        for (EntityChange change : plan.changes()) {
            if (change.after() == null) {
                for (Constraint removed : graph.removeForEntity(change.entityId())) {
                    constraintChanges.add(new ConstraintChange(removed.id(), removed, null));
                    removedConstraints.add(removed.id());
                }
            }
        }
        Set<String> affected = new LinkedHashSet<>(changedIds);
        for (Constraint carried : sourceGraph.all()) {
            if (graph.contains(carried.id()) || graph.isRetired(carried.id())) {
                continue;
            }
            if (carried.entityIds().stream().anyMatch(id -> !merged.containsKey(id))) {
                log.debug("Not carrying constraint {}: an entity is missing from the merged view", carried.id());
                continue;
            }
            ApplyOutcome outcome = solver.apply(graph, asCandidate(carried), mergedLookup);
            constraintChanges.add(new ConstraintChange(carried.id(), null, outcome.constraint()));
            addedConstraints.add(carried.id());
            affected.addAll(carried.entityIds());
        }
        affected.removeIf(id -> !merged.containsKey(id));
        List<Constraint> reevaluated = solver.reevaluate(graph, affected, mergedLookup);

        // commit
        String operationId = null;
        long newHead = targetHead;
        if (!plan.changes().isEmpty() || !constraintChanges.isEmpty()) {
            long sequence = operationLog.nextSequence(targetId);
            for (EntityChange change : plan.changes()) {
                if (change.after() == null) {
                    entityStore.tombstone(targetId, sequence, change.entityId());
                } else {
                    entityStore.put(targetId, sequence, change.after());
                }
            }
            constraintService.install(targetId, graph);
            OperationRecord record = operationLog.append(targetId, OperationType.MERGE, agentId,
                    List.copyOf(changedIds), plan.changes(), constraintChanges, null);
            operationId = record.operationId();
            newHead = record.sequence();
        }

        long sourceSynced = sourceHead;
        if (targetId.equals(source.baseWorkspaceId())) {
            sourceSynced = syncWithBase(sourceId, sourceGraph, sourceView, targetId, newHead, agentId);
            source = source.withDivergencePoint(newHead);
        } else if (sourceId.equals(target.baseWorkspaceId()) && operationId != null) {
            // re-linked at the merge record so earlier target sequences keep their view
            entityStore.rebase(targetId, newHead, sourceHead, false);
            registry.update(target.withDivergencePoint(sourceHead));
        }
        if (!source.isRoot()) {
            source = source.markMerged(sourceSynced);
        }
        registry.update(source);

        log.info("Merged '{}' into '{}' ({}): +{} ~{} -{} entities, {} conflict(s) resolved, {} constraint(s) carried",
                sourceId, targetId, strategy.value(), plan.added(), plan.modified(), plan.deleted(),
                plan.resolved().size(), addedConstraints.size());
        return new MergeResult(sourceId, targetId, strategy,
                plan.added(), plan.modified(), plan.deleted(), plan.resolved(),
                addedConstraints, removedConstraints,
                reevaluated.stream().map(Constraint::id).toList(),
                operationId, newHead);
    }

    /**
     * Makes a branch mirror its base again after merging into it. The switch is
     * recorded as a MERGE in the branch's own log, so sequences up to the old
     * head (and branches forked at them) keep their view.
     *
     * @return the sequence of the sync record
     */
    private long syncWithBase(String branchId, ConstraintGraph branchGraph, Map<String, Entity> branchView,
                              String baseId, long baseHead, String agentId) {
        Map<String, Entity> baseView = entityStore.snapshot(baseId, baseHead);
        List<EntityChange> entityChanges = new ArrayList<>();
        Set<String> ids = new TreeSet<>(branchView.keySet());
        ids.addAll(baseView.keySet());
        for (String id : ids) {
            Entity before = branchView.get(id);
            Entity after = baseView.get(id);
            if (!Objects.equals(before, after)) {
                entityChanges.add(new EntityChange(id, before, after));
            }
        }

        ConstraintGraph baseGraph = constraintService.copyOf(baseId);
        List<ConstraintChange> constraintChanges = new ArrayList<>();
        for (Constraint before : branchGraph.all()) {
            if (!baseGraph.contains(before.id())) {
                constraintChanges.add(new ConstraintChange(before.id(), before, null));
            }
        }
        for (Constraint after : baseGraph.all()) {
            Constraint before = branchGraph.get(after.id()).orElse(null);
            if (!after.equals(before)) {
                constraintChanges.add(new ConstraintChange(after.id(), before, after));
            }
        }

        long sequence = operationLog.nextSequence(branchId);
        entityStore.rebase(branchId, sequence, baseHead, true);
        constraintService.install(branchId, baseGraph);
        OperationRecord record = operationLog.append(branchId, OperationType.MERGE, agentId,
                entityChanges.stream().map(EntityChange::entityId).toList(), entityChanges, constraintChanges, null);
        log.debug("Synced '{}' with '{}' at sequence {} ({} entity change(s))",
                branchId, baseId, record.sequence(), entityChanges.size());
        return record.sequence();
    }

    /**
     * Nearest workspace visible from both sides, at the lower of the two sequences through which they see it.
     */
    private LineagePoint mergeBase(String sourceId, long sourceHead, String targetId, long targetHead) {
        List<LineagePoint> sourceChain = entityStore.lineage(sourceId, sourceHead);
        List<LineagePoint> targetChain = entityStore.lineage(targetId, targetHead);
        for (LineagePoint s : sourceChain) {
            for (LineagePoint t : targetChain) {
                if (s.workspaceId().equals(t.workspaceId())) {
                    return new LineagePoint(s.workspaceId(), Math.min(s.sequence(), t.sequence()));
                }
            }
        }
        throw new InvalidOperationException("Workspaces '" + sourceId + "' and '" + targetId + "' share no ancestor",
                Map.of("source_workspace_id", sourceId, "target_workspace_id", targetId));
    }

    private static void checkParents(Map<String, Entity> merged, String targetId) {
        for (Entity entity : merged.values()) {
            for (String parentId : entity.parentIds()) {
                if (!merged.containsKey(parentId)) {
                    throw new InvalidOperationException(
                            "Merge would leave '" + entity.id() + "' without its parent '" + parentId + "'",
                            Map.of("target_workspace_id", targetId, "entity_id", entity.id(), "parent_id", parentId));
                }
            }
        }
    }

    /** A carried constraint re-enters DOF accounting from scratch. */
    private static Constraint asCandidate(Constraint carried) {
        if (carried.status() != ConstraintStatus.REDUNDANT) {
            return carried;
        }
        return new Constraint(carried.id(), carried.type(), carried.entityIds(), carried.parameters(),
                carried.tolerance(), ConstraintStatus.SATISFIED, carried.type().dofRemoved(),
                carried.expected(), carried.actual(), carried.createdBy(), carried.createdAt());
    }

    private void initializeRoot() {
        String rootId = rootId();
        if (registry.exists(rootId)) {
            return;
        }
        entityStore.createRoot(rootId);
        operationLog.register(rootId);
        constraintService.initialize(rootId);
        registry.register(new Workspace(rootId, rootId, null, 0, 0, "system", clock.instant(), false));
        log.info("Initialized root workspace '{}'", rootId);
    }

    private static void requireAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            throw new InvalidOperationException("An agent id is required");
        }
    }
}
