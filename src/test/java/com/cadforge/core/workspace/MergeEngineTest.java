package com.cadforge.core.workspace;

import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.ConflictType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import com.cadforge.core.model.MergeStrategy;
import com.cadforge.core.model.ResolutionOption;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MergeEngineTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final MergeEngine engine = new MergeEngine();

    private static Entity circle(String id, long version, double cx, double cy, double r) {
        return new Entity(id, EntityType.CIRCLE, Map.of("cx", cx, "cy", cy, "cz", 0.0, "r", r), version,
                List.of("main:sketch_1"), "agent-a", NOW, NOW);
    }

    private MergePlan plan(Map<String, Entity> base, Map<String, Entity> source, Map<String, Entity> target,
                           MergeStrategy strategy, Map<String, ConflictResolution> resolutions) {
        return engine.plan(base, source, target, strategy, resolutions, NOW);
    }

    @Nested
    @DisplayName("clean merges")
    class Clean {

        @Test
        @DisplayName("nothing changed in source means nothing to write")
        void sourceUnchanged() {
            var c = circle("c", 1, 0, 0, 5);
            var moved = circle("c", 2, 2, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", c), Map.of("c", moved), MergeStrategy.AUTO, Map.of());

            assertTrue(result.changes().isEmpty());
            assertFalse(result.hasConflicts());
        }

        @Test
        @DisplayName("source-only modification is taken with a bumped version")
        void sourceOnlyModification() {
            var c = circle("c", 1, 0, 0, 5);
            var grown = circle("c", 2, 0, 0, 7);

            var result = plan(Map.of("c", c), Map.of("c", grown), Map.of("c", c), MergeStrategy.AUTO, Map.of());

            assertEquals(1, result.modified());
            Entity after = result.changes().get(0).after();
            assertEquals(7.0, after.param("r"));
            assertEquals(3, after.version());
        }

        @Test
        @DisplayName("additions and deletions in source carry over")
        void addAndDelete() {
            var kept = circle("a", 1, 0, 0, 1);
            var removed = circle("b", 1, 5, 5, 1);
            var fresh = circle("n", 1, 9, 9, 1);

            var result = plan(Map.of("a", kept, "b", removed),
                    Map.of("a", kept, "n", fresh),
                    Map.of("a", kept, "b", removed),
                    MergeStrategy.AUTO, Map.of());

            assertEquals(1, result.added());
            assertEquals(1, result.deleted());
            assertEquals(0, result.modified());
        }

        @Test
        @DisplayName("different parameters changed on each side merge parameter-wise")
        void disjointParameters() {
            var c = circle("c", 1, 0, 0, 5);
            var source = circle("c", 2, 0, 0, 7);
            var target = circle("c", 2, 2, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", source), Map.of("c", target), MergeStrategy.AUTO, Map.of());

            assertFalse(result.hasConflicts());
            assertEquals(1, result.modified());
            Entity after = result.changes().get(0).after();
            assertEquals(2.0, after.param("cx"));
            assertEquals(7.0, after.param("r"));
        }

        @Test
        @DisplayName("identical changes on both sides are not a conflict")
        void identicalChanges() {
            var c = circle("c", 1, 0, 0, 5);
            var same = circle("c", 2, 0, 0, 9);

            var result = plan(Map.of("c", c), Map.of("c", same), Map.of("c", same), MergeStrategy.AUTO, Map.of());

            assertTrue(result.changes().isEmpty());
            assertFalse(result.hasConflicts());
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("same parameter changed to different values is both_modified")
        void bothModified() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", circle("c", 2, 0, 0, 7)),
                    Map.of("c", circle("c", 2, 0, 0, 10)), MergeStrategy.AUTO, Map.of());

            assertTrue(result.hasConflicts());
            var conflict = result.unresolved().get(0);
            assertEquals(ConflictType.BOTH_MODIFIED, conflict.type());
            assertEquals(List.of("r"), conflict.conflictingParameters());
            assertEquals(List.of(ResolutionOption.KEEP_SOURCE, ResolutionOption.KEEP_TARGET,
                    ResolutionOption.MANUAL_MERGE), conflict.resolutionOptions());
            assertTrue(result.changes().isEmpty());
        }

        @Test
        @DisplayName("deleted in source but modified in target is delete_modified")
        void deleteModified() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of(), Map.of("c", circle("c", 2, 3, 0, 5)),
                    MergeStrategy.AUTO, Map.of());

            assertEquals(ConflictType.DELETE_MODIFIED, result.unresolved().get(0).type());
            assertNull(result.unresolved().get(0).source());
        }

        @Test
        @DisplayName("keep_source strategy resolves every conflict in favour of the source")
        void keepSourceStrategy() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", circle("c", 2, 0, 0, 7)),
                    Map.of("c", circle("c", 2, 0, 0, 10)), MergeStrategy.KEEP_SOURCE, Map.of());

            assertFalse(result.hasConflicts());
            assertEquals(1, result.resolved().size());
            assertEquals(7.0, result.changes().get(0).after().param("r"));
        }

        @Test
        @DisplayName("keep_target resolution writes nothing")
        void keepTargetWritesNothing() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", circle("c", 2, 0, 0, 7)),
                    Map.of("c", circle("c", 2, 0, 0, 10)), MergeStrategy.AUTO,
                    Map.of("c", ConflictResolution.of(ResolutionOption.KEEP_TARGET)));

            assertFalse(result.hasConflicts());
            assertEquals(1, result.resolved().size());
            assertTrue(result.changes().isEmpty());
        }

        @Test
        @DisplayName("manual_merge applies the given parameters over the target")
        void manualMerge() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", circle("c", 2, 0, 0, 7)),
                    Map.of("c", circle("c", 2, 0, 0, 10)), MergeStrategy.MANUAL,
                    Map.of("c", new ConflictResolution(ResolutionOption.MANUAL_MERGE, Map.of("r", 8.5))));

            assertEquals(8.5, result.changes().get(0).after().param("r"));
        }

        @Test
        @DisplayName("manual_merge without parameters is rejected")
        void manualMergeNeedsParameters() {
            var c = circle("c", 1, 0, 0, 5);

            assertThrows(InvalidOperationException.class, () -> plan(Map.of("c", c),
                    Map.of("c", circle("c", 2, 0, 0, 7)), Map.of("c", circle("c", 2, 0, 0, 10)),
                    MergeStrategy.MANUAL, Map.of("c", ConflictResolution.of(ResolutionOption.MANUAL_MERGE))));
        }

        @Test
        @DisplayName("manual strategy leaves conflicts without a resolution unresolved")
        void manualStrategyNeedsResolutions() {
            var c = circle("c", 1, 0, 0, 5);

            var result = plan(Map.of("c", c), Map.of("c", circle("c", 2, 0, 0, 7)),
                    Map.of("c", circle("c", 2, 0, 0, 10)), MergeStrategy.MANUAL, Map.of());

            assertEquals(1, result.unresolved().size());
        }
    }
}
