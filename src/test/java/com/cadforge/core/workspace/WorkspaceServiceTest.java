package com.cadforge.core.workspace;

import com.cadforge.CadforgeFixture;
import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.error.BaseNotFoundException;
import com.cadforge.core.error.ConstraintConflictException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.error.WorkspaceConflictException;
import com.cadforge.core.model.BranchStatus;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.ConflictType;
import com.cadforge.core.model.ConstraintType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.MergeStrategy;
import com.cadforge.core.model.OperationType;
import com.cadforge.core.model.ResolutionOption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static com.cadforge.CadforgeFixture.ROOT;
import static org.junit.jupiter.api.Assertions.*;

class WorkspaceServiceTest {

    private static final String AGENT_B = "agent-b";

    private CadforgeFixture fx;
    private Entity sketch;

    @BeforeEach
    void setUp() {
        fx = new CadforgeFixture();
        sketch = fx.sketch(ROOT);
    }

    private double param(String workspaceId, String entityId, String key) {
        return fx.entities.query(workspaceId, entityId).entity().param(key);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("the root workspace exists from the start")
        void rootExists() {
            var status = fx.workspaces.status(ROOT);
            assertTrue(status.workspace().isRoot());
            assertFalse(status.canMerge());
        }

        @Test
        @DisplayName("a workspace id is agent-qualified and diverges at the base head")
        void qualifiedId() {
            long head = fx.operationLog.head(ROOT);

            var workspace = fx.workspaces.create("w1", null, AGENT_B);

            assertEquals("agent-b:w1", workspace.id());
            assertEquals(ROOT, workspace.baseWorkspaceId());
            assertEquals(head, workspace.divergencePoint());
            assertEquals(AGENT_B, workspace.ownerAgentId());
            assertEquals(BranchStatus.CLEAN, fx.workspaces.status(workspace.id()).status());
        }

        @Test
        @DisplayName("the same name twice for one agent is rejected")
        void duplicate() {
            fx.workspaces.create("w1", ROOT, AGENT_B);

            assertThrows(InvalidOperationException.class, () -> fx.workspaces.create("w1", ROOT, AGENT_B));
        }

        @Test
        @DisplayName("an unknown base is reported as base not found")
        void unknownBase() {
            assertThrows(BaseNotFoundException.class, () -> fx.workspaces.create("w1", "nobody:nothing", AGENT_B));
        }

        @Test
        @DisplayName("names outside the allowed characters are rejected")
        void badName() {
            assertThrows(InvalidOperationException.class, () -> fx.workspaces.create("has space", ROOT, AGENT_B));
        }

        @Test
        @DisplayName("a fork sees its base as of the fork and nothing later")
        void forkIsolation() {
            var before = fx.point(ROOT, sketch.id(), 1, 1);
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();
            var after = fx.point(ROOT, sketch.id(), 2, 2);
            var local = fx.point(ws, sketch.id(), 3, 3);

            assertTrue(fx.entityStore.find(ws, before.id()).isPresent());
            assertTrue(fx.entityStore.find(ws, after.id()).isEmpty());
            assertTrue(fx.entityStore.find(ROOT, local.id()).isEmpty());
            assertEquals(BranchStatus.MODIFIED, fx.workspaces.status(ws).status());
        }

        @Test
        @DisplayName("constraints are copied into a fork")
        void constraintsCopied() {
            var c = fx.circle(ROOT, sketch.id(), 0, 0, 5);
            fx.constraints.apply(ROOT, ConstraintType.RADIUS, List.of(c.id()), Map.of("radius", 5.0), null, "agent-a");

            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();

            assertEquals(1, fx.constraints.count(ws));
        }
    }

    @Nested
    @DisplayName("merge")
    class Merge {

        private Entity circle;
        private String ws;

        @BeforeEach
        void setUp() {
            circle = fx.circle(ROOT, sketch.id(), 0, 0, 5);
            ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();
        }

        @Test
        @DisplayName("disjoint parameter edits merge cleanly into the base")
        void disjointEdits() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("cx", 2.0), "agent-a");

            var result = fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(1, result.entitiesModified());
            assertTrue(result.resolvedConflicts().isEmpty());
            assertEquals(2.0, param(ROOT, circle.id(), "cx"));
            assertEquals(7.0, param(ROOT, circle.id(), "r"));
            assertEquals(OperationType.MERGE, fx.operationLog.list(ROOT, 1, 0).get(0).type());
            assertEquals(BranchStatus.MERGED, fx.workspaces.status(ws).status());
        }

        @Test
        @DisplayName("after merging into its base a branch sees the base's changes")
        void branchRebased() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("cx", 2.0), "agent-a");

            fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(2.0, param(ws, circle.id(), "cx"));
            assertEquals(7.0, param(ws, circle.id(), "r"));
            assertFalse(fx.workspaces.status(ws).canMerge());
        }

        @Test
        @DisplayName("syncing a branch with its base never changes the branch's earlier sequences")
        void branchHistoryKept() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            long headBefore = fx.operationLog.head(ws);
            var nested = fx.workspaces.create("w1a", ws, AGENT_B).id();
            fx.entities.update(ROOT, circle.id(), Map.of("cx", 10.0), "agent-a");

            fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(0.0, param(nested, circle.id(), "cx"));
            assertEquals(7.0, param(nested, circle.id(), "r"));
            assertEquals(0.0, fx.entityStore.find(ws, circle.id(), headBefore).orElseThrow().param("cx"));
            assertEquals(10.0, param(ws, circle.id(), "cx"));
        }

        @Test
        @DisplayName("the sync with the base is a merge record in the branch's own log")
        void syncRecorded() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("cx", 10.0), "agent-a");

            fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            var sync = fx.operationLog.list(ws, 1, 0).get(0);
            assertEquals(OperationType.MERGE, sync.type());
            assertEquals(2, sync.sequence());
            assertEquals(List.of(circle.id()), sync.entityIds());
            assertEquals(BranchStatus.MERGED, fx.workspaces.status(ws).status());

            fx.history.undo(ws, AGENT_B);

            assertEquals(0.0, param(ws, circle.id(), "cx"));
            assertEquals(7.0, param(ws, circle.id(), "r"));
            assertEquals(BranchStatus.MODIFIED, fx.workspaces.status(ws).status());
        }

        @Test
        @DisplayName("the same parameter changed on both sides aborts with one conflict")
        void conflictingEdits() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("r", 10.0), "agent-a");
            long headBefore = fx.operationLog.head(ROOT);

            var ex = assertThrows(WorkspaceConflictException.class,
                    () -> fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));

            assertEquals(1, ex.conflicts().size());
            var conflict = ex.conflicts().get(0);
            assertEquals(circle.id(), conflict.entityId());
            assertEquals(ConflictType.BOTH_MODIFIED, conflict.type());
            assertEquals(List.of("r"), conflict.conflictingParameters());
            assertEquals(3, conflict.resolutionOptions().size());
            assertEquals(10.0, param(ROOT, circle.id(), "r"));
            assertEquals(headBefore, fx.operationLog.head(ROOT));
            assertEquals(BranchStatus.MODIFIED, fx.workspaces.status(ws).status());
            assertEquals(1.0, fx.meterRegistry.find("cadforge.merges.total")
                    .tag("outcome", "conflict").counter().count());
        }

        @Test
        @DisplayName("keep_source settles a conflict with the branch value")
        void keepSource() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("r", 10.0), "agent-a");

            var result = fx.workspaces.merge(ws, ROOT, MergeStrategy.KEEP_SOURCE, Map.of(), AGENT_B);

            assertEquals(1, result.resolvedConflicts().size());
            assertEquals(7.0, param(ROOT, circle.id(), "r"));
        }

        @Test
        @DisplayName("an explicit manual resolution writes the agreed value")
        void manualResolution() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("r", 10.0), "agent-a");

            fx.workspaces.merge(ws, ROOT, MergeStrategy.MANUAL,
                    Map.of(circle.id(), new ConflictResolution(ResolutionOption.MANUAL_MERGE, Map.of("r", 8.5))),
                    AGENT_B);

            assertEquals(8.5, param(ROOT, circle.id(), "r"));
        }

        @Test
        @DisplayName("a constraint conflict aborts the merge and leaves the target untouched")
        void constraintConflictIsAtomic() {
            var l1 = fx.line(ROOT, sketch.id(), 0, 0, 1, 0);
            var l2 = fx.line(ROOT, sketch.id(), 0, 0, 0, 1);
            var branch = fx.workspaces.create("w2", ROOT, AGENT_B).id();
            fx.entities.update(branch, circle.id(), Map.of("r", 9.0), AGENT_B);
            fx.constraints.apply(branch, ConstraintType.PARALLEL, List.of(l1.id(), l2.id()), Map.of(), null, AGENT_B);
            fx.constraints.apply(ROOT, ConstraintType.PERPENDICULAR, List.of(l1.id(), l2.id()), Map.of(), null, "agent-a");
            long headBefore = fx.operationLog.head(ROOT);

            assertThrows(ConstraintConflictException.class,
                    () -> fx.workspaces.merge(branch, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));

            assertEquals(5.0, param(ROOT, circle.id(), "r"));
            assertEquals(1, fx.constraints.count(ROOT));
            assertEquals(headBefore, fx.operationLog.head(ROOT));
            assertTrue(fx.locks.status("workspace", ROOT).isEmpty());
        }

        @Test
        @DisplayName("constraints declared in a branch are carried into the target")
        void carriesConstraints() {
            var applied = fx.constraints.apply(ws, ConstraintType.RADIUS, List.of(circle.id()),
                    Map.of("radius", 5.0), null, AGENT_B);

            var result = fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(List.of(applied.constraint().id()), result.constraintsAdded());
            assertTrue(fx.constraints.find(ROOT, applied.constraint().id()).isPresent());
        }

        @Test
        @DisplayName("entities added and deleted in a branch carry over")
        void addAndDelete() {
            var extra = fx.point(ROOT, sketch.id(), 4, 4);
            var branch = fx.workspaces.create("w2", ROOT, AGENT_B).id();
            var added = fx.point(branch, sketch.id(), 8, 8);
            fx.entities.delete(branch, extra.id(), AGENT_B);

            var result = fx.workspaces.merge(branch, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(1, result.entitiesAdded());
            assertEquals(1, result.entitiesDeleted());
            assertTrue(fx.entityStore.find(ROOT, added.id()).isPresent());
            assertTrue(fx.entityStore.find(ROOT, extra.id()).isEmpty());
        }

        @Test
        @DisplayName("deleting what the target modified is a delete_modified conflict")
        void deleteModified() {
            fx.entities.delete(ws, circle.id(), AGENT_B);
            fx.entities.update(ROOT, circle.id(), Map.of("r", 6.0), "agent-a");

            var ex = assertThrows(WorkspaceConflictException.class,
                    () -> fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));

            assertEquals(ConflictType.DELETE_MODIFIED, ex.conflicts().get(0).type());
        }

        @Test
        @DisplayName("a merged branch without new work cannot be merged again")
        void mergedTwice() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertThrows(InvalidOperationException.class,
                    () -> fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));
        }

        @Test
        @DisplayName("a workspace cannot be merged into itself")
        void intoItself() {
            assertThrows(InvalidOperationException.class,
                    () -> fx.workspaces.merge(ws, ws, MergeStrategy.AUTO, Map.of(), AGENT_B));
        }

        @Test
        @DisplayName("an unknown source is reported as base not found")
        void unknownSource() {
            assertThrows(BaseNotFoundException.class,
                    () -> fx.workspaces.merge("nobody:nothing", ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));
        }

        @Test
        @DisplayName("a merge waits for another agent's lease on the target")
        void targetLeased() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.locks.acquire("workspace", ROOT, "agent-z", null, 30L);

            assertThrows(AlreadyLockedException.class,
                    () -> fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B));
            assertEquals(5.0, param(ROOT, circle.id(), "r"));
        }

        @Test
        @DisplayName("the merging agent's own lease survives the merge")
        void ownLeaseKept() {
            fx.entities.update(ws, circle.id(), Map.of("r", 7.0), AGENT_B);
            fx.locks.acquire("workspace", ROOT, AGENT_B, null, 120L);

            fx.workspaces.merge(ws, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertTrue(fx.locks.status("workspace", ROOT).isPresent());
        }
    }

    @Nested
    @DisplayName("merge direction")
    class Direction {

        private Set<Map<String, Double>> mergeDisjointEdits(boolean branchIntoBase) {
            var local = new CadforgeFixture();
            var s = local.sketch(ROOT);
            var p1 = local.point(ROOT, s.id(), 0, 0);
            var p2 = local.point(ROOT, s.id(), 5, 5);
            var branch = local.workspaces.create("w1", ROOT, AGENT_B).id();
            local.entities.update(branch, p1.id(), Map.of("x", 1.0), AGENT_B);
            local.entities.update(ROOT, p2.id(), Map.of("y", 6.0), "agent-a");

            String target;
            if (branchIntoBase) {
                local.workspaces.merge(branch, ROOT, MergeStrategy.AUTO, Map.of(), AGENT_B);
                target = ROOT;
            } else {
                local.workspaces.merge(ROOT, branch, MergeStrategy.AUTO, Map.of(), AGENT_B);
                target = branch;
            }
            return local.entities.list(target, EntityType.POINT).stream()
                    .map(Entity::parameters)
                    .collect(Collectors.toSet());
        }

        @Test
        @DisplayName("disjoint edits give the same content in either direction")
        void commutative() {
            var intoBase = mergeDisjointEdits(true);
            var intoBranch = mergeDisjointEdits(false);

            assertEquals(intoBase, intoBranch);
            assertTrue(intoBase.contains(Map.of("x", 1.0, "y", 0.0, "z", 0.0)));
            assertTrue(intoBase.contains(Map.of("x", 5.0, "y", 6.0, "z", 0.0)));
        }

        @Test
        @DisplayName("merging the base into a branch keeps the base clean and the branch open")
        void baseIntoBranch() {
            var p = fx.point(ROOT, sketch.id(), 0, 0);
            var branch = fx.workspaces.create("w1", ROOT, AGENT_B).id();
            fx.entities.update(ROOT, p.id(), Map.of("x", 3.0), "agent-a");

            fx.workspaces.merge(ROOT, branch, MergeStrategy.AUTO, Map.of(), AGENT_B);

            assertEquals(3.0, param(branch, p.id(), "x"));
            assertFalse(fx.registry.require(ROOT).merged());
            assertTrue(fx.workspaces.status(branch).canMerge());
        }
    }

    @Nested
    @DisplayName("delete")
    class Delete {

        @Test
        @DisplayName("the owner can delete a branch")
        void ownerDeletes() {
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();

            fx.workspaces.delete(ws, AGENT_B);

            assertFalse(fx.registry.exists(ws));
        }

        @Test
        @DisplayName("another agent cannot delete a branch")
        void foreignAgent() {
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();

            assertThrows(InvalidOperationException.class, () -> fx.workspaces.delete(ws, "agent-a"));
        }

        @Test
        @DisplayName("the root cannot be deleted")
        void root() {
            assertThrows(InvalidOperationException.class, () -> fx.workspaces.delete(ROOT, "system"));
        }

        @Test
        @DisplayName("a workspace with branches cannot be deleted")
        void withBranches() {
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();
            fx.workspaces.create("w2", ws, AGENT_B);

            assertThrows(InvalidOperationException.class, () -> fx.workspaces.delete(ws, AGENT_B));
        }

        @Test
        @DisplayName("a delete waiting on a fork in progress sees the new branch")
        void concurrentFork() throws Exception {
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();
            var forkStarted = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var deleteError = new AtomicReference<Throwable>();

            var forker = new Thread(() -> fx.registry.locked(ws, () -> {
                forkStarted.countDown();
                await(release);
                return fx.workspaces.create("w1a", ws, "agent-c");
            }));
            forker.start();
            assertTrue(forkStarted.await(5, TimeUnit.SECONDS));

            var deleter = new Thread(() -> {
                try {
                    fx.workspaces.delete(ws, AGENT_B);
                } catch (Throwable e) {
                    deleteError.set(e);
                }
            });
            deleter.start();
            while (deleter.getState() != Thread.State.WAITING && deleter.isAlive()) {
                Thread.onSpinWait();
            }
            release.countDown();
            forker.join(5000);
            deleter.join(5000);

            assertInstanceOf(InvalidOperationException.class, deleteError.get());
            assertTrue(fx.registry.exists(ws));
            assertTrue(fx.registry.exists("agent-c:w1a"));
        }

        @Test
        @DisplayName("a fork whose base was deleted while it waited is rejected")
        void baseDeletedWhileWaiting() throws Exception {
            var ws = fx.workspaces.create("w1", ROOT, AGENT_B).id();
            var deleteStarted = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var createError = new AtomicReference<Throwable>();

            var deleter = new Thread(() -> fx.registry.locked(ws, () -> {
                deleteStarted.countDown();
                await(release);
                return fx.workspaces.delete(ws, AGENT_B);
            }));
            deleter.start();
            assertTrue(deleteStarted.await(5, TimeUnit.SECONDS));

            var creator = new Thread(() -> {
                try {
                    fx.workspaces.create("w1a", ws, "agent-c");
                } catch (Throwable e) {
                    createError.set(e);
                }
            });
            creator.start();
            while (creator.getState() != Thread.State.WAITING && creator.isAlive()) {
                Thread.onSpinWait();
            }
            release.countDown();
            deleter.join(5000);
            creator.join(5000);

            assertInstanceOf(BaseNotFoundException.class, createError.get());
            assertFalse(fx.registry.exists("agent-c:w1a"));
        }

        private void await(CountDownLatch latch) {
            try {
                assertTrue(latch.await(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }
}
