package com.cadforge.core.entity;

import com.cadforge.CadforgeFixture;
import com.cadforge.core.error.EntityNotFoundException;
import com.cadforge.core.error.InvalidEntityException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.error.WorkspaceNotFoundException;
import com.cadforge.core.model.ConstraintType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.cadforge.CadforgeFixture.ROOT;
import static org.junit.jupiter.api.Assertions.*;

class EntityServiceTest {

    private CadforgeFixture fx;
    private Entity sketch;

    @BeforeEach
    void setUp() {
        fx = new CadforgeFixture();
        sketch = fx.sketch(ROOT);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("a new entity starts at version 1 with a workspace-qualified id")
        void firstVersion() {
            var p = fx.point(ROOT, sketch.id(), 1, 2);

            assertTrue(p.id().startsWith("main:point_"));
            assertEquals(1, p.version());
            assertEquals(0.0, p.param("z"));
            assertEquals(List.of(sketch.id()), p.parentIds());
            assertEquals("agent-a", p.createdBy());
            assertEquals(OperationType.ENTITY_CREATE, fx.operationLog.list(ROOT, 1, 0).get(0).type());
        }

        @Test
        @DisplayName("a non-positive radius is rejected")
        void negativeRadius() {
            assertThrows(InvalidEntityException.class, () -> fx.circle(ROOT, sketch.id(), 0, 0, -1));
        }

        @Test
        @DisplayName("unknown parameters are rejected")
        void unknownParameter() {
            assertThrows(InvalidEntityException.class, () -> fx.entities.create(ROOT, EntityType.POINT,
                    Map.of("x", 1.0, "y", 2.0, "w", 3.0), List.of(sketch.id()), "agent-a"));
        }

        @Test
        @DisplayName("a solid needs exactly one parent sketch")
        void solidNeedsSketch() {
            assertThrows(InvalidEntityException.class, () -> fx.entities.create(ROOT, EntityType.SOLID,
                    Map.of("height", 10.0), List.of(), "agent-a"));
            var solid = fx.entities.create(ROOT, EntityType.SOLID, Map.of("height", 10.0),
                    List.of(sketch.id()), "agent-a");
            assertEquals(10.0, solid.param("height"));
        }

        @Test
        @DisplayName("a point cannot belong to another point")
        void wrongParentKind() {
            var p = fx.point(ROOT, sketch.id(), 0, 0);

            assertThrows(InvalidEntityException.class, () -> fx.entities.create(ROOT, EntityType.POINT,
                    Map.of("x", 1.0, "y", 1.0), List.of(p.id()), "agent-a"));
        }

        @Test
        @DisplayName("a missing parent is reported as not found")
        void missingParent() {
            assertThrows(EntityNotFoundException.class, () -> fx.entities.create(ROOT, EntityType.POINT,
                    Map.of("x", 1.0, "y", 1.0), List.of("main:sketch_missing"), "agent-a"));
        }

        @Test
        @DisplayName("an agent id is required")
        void agentRequired() {
            assertThrows(InvalidOperationException.class, () -> fx.entities.create(ROOT, EntityType.SKETCH,
                    Map.of(), List.of(), " "));
        }

        @Test
        @DisplayName("an unknown workspace is reported")
        void unknownWorkspace() {
            assertThrows(WorkspaceNotFoundException.class, () -> fx.sketch("nobody:nothing"));
        }
    }

    @Nested
    @DisplayName("update and delete")
    class UpdateDelete {

        @Test
        @DisplayName("an update merges parameters into a new version")
        void update() {
            var c = fx.circle(ROOT, sketch.id(), 1, 1, 5);

            var result = fx.entities.update(ROOT, c.id(), Map.of("r", 7.0), "agent-b");

            assertEquals(2, result.entity().version());
            assertEquals(1.0, result.entity().param("cx"));
            assertEquals(7.0, result.entity().param("r"));
            assertEquals(c.createdAt(), result.entity().createdAt());
            assertEquals(1, fx.entityStore.find(ROOT, c.id(), 2).orElseThrow().version());
        }

        @Test
        @DisplayName("an empty update is rejected")
        void emptyUpdate() {
            var c = fx.circle(ROOT, sketch.id(), 1, 1, 5);

            assertThrows(InvalidEntityException.class, () -> fx.entities.update(ROOT, c.id(), Map.of(), "agent-a"));
        }

        @Test
        @DisplayName("updating an unknown entity is reported as not found")
        void updateUnknown() {
            assertThrows(EntityNotFoundException.class,
                    () -> fx.entities.update(ROOT, "main:point_missing", Map.of("x", 1.0), "agent-a"));
        }

        @Test
        @DisplayName("a deleted entity is no longer visible")
        void delete() {
            var p = fx.point(ROOT, sketch.id(), 0, 0);

            fx.entities.delete(ROOT, p.id(), "agent-a");

            assertThrows(EntityNotFoundException.class, () -> fx.entities.query(ROOT, p.id()));
            assertTrue(fx.entities.list(ROOT, EntityType.POINT).isEmpty());
        }

        @Test
        @DisplayName("an entity with children cannot be deleted")
        void deleteWithChildren() {
            fx.point(ROOT, sketch.id(), 0, 0);

            assertThrows(InvalidEntityException.class, () -> fx.entities.delete(ROOT, sketch.id(), "agent-a"));
        }
    }

    @Nested
    @DisplayName("query and list")
    class Query {

        @Test
        @DisplayName("query returns derived properties, children and constraints")
        void query() {
            var line = fx.line(ROOT, sketch.id(), 0, 0, 3, 4);
            fx.constraints.apply(ROOT, ConstraintType.DISTANCE, List.of(line.id()),
                    Map.of("distance", 5.0), null, "agent-a");

            var details = fx.entities.query(ROOT, line.id());

            assertEquals(5.0, details.properties().get("length"), 1e-9);
            assertEquals(1, details.constraints().size());
            assertEquals(List.of(line.id()), fx.entities.query(ROOT, sketch.id()).childIds());
        }

        @Test
        @DisplayName("list filters by type")
        void listByType() {
            fx.point(ROOT, sketch.id(), 0, 0);
            fx.circle(ROOT, sketch.id(), 0, 0, 1);

            assertEquals(1, fx.entities.list(ROOT, EntityType.CIRCLE).size());
            assertEquals(3, fx.entities.list(ROOT, null).size());
        }
    }
}
