package com.cadforge;

import com.cadforge.core.config.CadforgeProperties;
import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.constraint.ConstraintSolver;
import com.cadforge.core.coordination.InMemoryLeaseLockStore;
import com.cadforge.core.coordination.LeaseLockService;
import com.cadforge.core.coordination.LeaseLockStore;
import com.cadforge.core.entity.EntityService;
import com.cadforge.core.entity.EntityStore;
import com.cadforge.core.geometry.AnalyticGeometryEngine;
import com.cadforge.core.metrics.CadforgeMetrics;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.oplog.HistoryService;
import com.cadforge.core.oplog.OperationLog;
import com.cadforge.core.workspace.MergeEngine;
import com.cadforge.core.workspace.WorkspaceRegistry;
import com.cadforge.core.workspace.WorkspaceService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Wires the core services by hand, without a Spring context, around an
 * in-memory lock store and a clock the test controls.
 */
public final class CadforgeFixture {

    public static final String ROOT = "main";

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final CadforgeProperties properties = new CadforgeProperties();
    public final CadforgeMetrics metrics = new CadforgeMetrics(meterRegistry);
    public final AnalyticGeometryEngine geometry = new AnalyticGeometryEngine();
    public final WorkspaceRegistry registry = new WorkspaceRegistry();
    public final EntityStore entityStore = new EntityStore();
    public final OperationLog operationLog = new OperationLog(clock);
    public final ConstraintSolver solver = new ConstraintSolver(geometry, properties);
    public final ConstraintService constraints;
    public final EntityService entities;
    public final LeaseLockStore lockStore;
    public final LeaseLockService locks;
    public final WorkspaceService workspaces;
    public final HistoryService history;

    public CadforgeFixture() {
        this(new InMemoryLeaseLockStore());
    }

    public CadforgeFixture(LeaseLockStore lockStore) {
        this.lockStore = lockStore;
        this.constraints = new ConstraintService(entityStore, operationLog, registry, solver, metrics, clock);
        this.entities = new EntityService(entityStore, operationLog, registry, constraints, geometry, clock);
        this.locks = new LeaseLockService(lockStore, clock, properties, metrics);
        this.workspaces = new WorkspaceService(registry, entityStore, operationLog, constraints,
                new MergeEngine(), locks, properties, metrics, clock);
        this.history = new HistoryService(operationLog, entityStore, registry, constraints, metrics, clock);
    }

    public Entity sketch(String workspaceId) {
        return entities.create(workspaceId, EntityType.SKETCH, Map.of(), List.of(), "agent-a");
    }

    public Entity point(String workspaceId, String sketchId, double x, double y) {
        return entities.create(workspaceId, EntityType.POINT, Map.of("x", x, "y", y), List.of(sketchId), "agent-a");
    }

    public Entity line(String workspaceId, String sketchId, double x1, double y1, double x2, double y2) {
        return entities.create(workspaceId, EntityType.LINE,
                Map.of("x1", x1, "y1", y1, "x2", x2, "y2", y2), List.of(sketchId), "agent-a");
    }

    public Entity circle(String workspaceId, String sketchId, double cx, double cy, double r) {
        return entities.create(workspaceId, EntityType.CIRCLE,
                Map.of("cx", cx, "cy", cy, "r", r), List.of(sketchId), "agent-a");
    }

    /** A clock tests can move forward. */
    public static final class MutableClock extends Clock {

        private Instant now;

        public MutableClock(Instant start) {
            this.now = start;
        }

        public void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
