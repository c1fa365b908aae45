package com.cadforge.core.workspace;

import com.cadforge.core.entity.EntityParameters;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.ConflictType;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.MergeConflict;
import com.cadforge.core.model.MergeStrategy;
import com.cadforge.core.model.ResolutionOption;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Three-way entity merge. Pure: it compares three snapshots and returns the
 * writes the target would need, leaving all state untouched.
 * <p>
 * For each entity id present in any snapshot:
 * <ul>
 *   <li>unchanged in source: nothing to do;</li>
 *   <li>changed only in source: take the source version (add, modify or delete);</li>
 *   <li>changed identically on both sides: nothing to do;</li>
 *   <li>modified differently on both sides: merge parameter by parameter, and
 *       report {@link ConflictType#BOTH_MODIFIED} if one parameter changed to
 *       different values on both sides;</li>
 *   <li>deleted on one side and modified on the other: {@link ConflictType#DELETE_MODIFIED}.</li>
 * </ul>
 */
@Component
public class MergeEngine {

    static final List<ResolutionOption> RESOLUTION_OPTIONS = List.of(
            ResolutionOption.KEEP_SOURCE, ResolutionOption.KEEP_TARGET, ResolutionOption.MANUAL_MERGE);

    private static final String PARENTS = "parent_ids";

    public MergePlan plan(Map<String, Entity> base,
                          Map<String, Entity> source,
                          Map<String, Entity> target,
                          MergeStrategy strategy,
                          Map<String, ConflictResolution> resolutions,
                          Instant now) {
        Map<String, ConflictResolution> decisions = resolutions == null ? Map.of() : resolutions;
        Set<String> ids = new TreeSet<>();
        ids.addAll(base.keySet());
        ids.addAll(source.keySet());
        ids.addAll(target.keySet());

        var plan = new PlanBuilder(now);
        for (String id : ids) {
            Entity b = base.get(id);
            Entity s = source.get(id);
            Entity t = target.get(id);

            if (Entity.sameContent(b, s)) {
                continue;
            }
            if (Entity.sameContent(b, t)) {
                plan.write(t, s);
                continue;
            }
            if (Entity.sameContent(s, t)) {
                continue;
            }

            MergeConflict conflict;
            if (s == null || t == null) {
                conflict = new MergeConflict(id, ConflictType.DELETE_MODIFIED, List.of(), b, s, t, RESOLUTION_OPTIONS);
            } else {
                Map<String, Double> mergedParams = new TreeMap<>();
                List<String> conflicting = new ArrayList<>();
                List<String> parents = mergeParameters(b, s, t, mergedParams, conflicting);
                if (conflicting.isEmpty()) {
                    plan.write(t, new Entity(id, t.type(), mergedParams, t.version(), parents,
                            t.createdBy(), t.createdAt(), now));
                    continue;
                }
                conflict = new MergeConflict(id, ConflictType.BOTH_MODIFIED, conflicting, b, s, t, RESOLUTION_OPTIONS);
            }

            ConflictResolution explicit = decisions.get(id);
            ResolutionOption option = explicit != null ? explicit.option() : switch (strategy) {
                case KEEP_SOURCE -> ResolutionOption.KEEP_SOURCE;
                case KEEP_TARGET -> ResolutionOption.KEEP_TARGET;
                case AUTO, MANUAL -> null;
            };
            if (option == null) {
                plan.unresolved.add(conflict);
                continue;
            }
            Entity outcome = switch (option) {
                case KEEP_SOURCE -> s;
                case KEEP_TARGET -> t;
                case MANUAL_MERGE -> manualMerge(conflict, explicit, now);
            };
            plan.resolved.add(conflict);
            if (!Entity.sameContent(t, outcome)) {
                plan.write(t, outcome);
            }
        }
        return plan.build();
    }

    /**
     * Parameter-wise three-way merge of two modified versions. Fills
     * {@code merged} and records the parameters that changed differently on
     * both sides in {@code conflicting}.
     *
     * @return the merged parent ids
     */
    private static List<String> mergeParameters(Entity b, Entity s, Entity t,
                                                Map<String, Double> merged, List<String> conflicting) {
        Set<String> keys = new TreeSet<>(s.parameters().keySet());
        keys.addAll(t.parameters().keySet());
        for (String key : keys) {
            Double bv = b != null ? b.parameters().get(key) : null;
            Double sv = s.parameters().get(key);
            Double tv = t.parameters().get(key);
            Double value;
            if (Objects.equals(sv, tv)) {
                value = sv;
            } else if (b != null && Objects.equals(sv, bv)) {
                value = tv;
            } else if (b != null && Objects.equals(tv, bv)) {
                value = sv;
            } else {
                conflicting.add(key);
                continue;
            }
            if (value != null) {
                merged.put(key, value);
            }
        }

        if (s.parentIds().equals(t.parentIds())) {
            return s.parentIds();
        }
        if (b != null && s.parentIds().equals(b.parentIds())) {
            return t.parentIds();
        }
        if (b != null && t.parentIds().equals(b.parentIds())) {
            return s.parentIds();
        }
        conflicting.add(PARENTS);
        return t.parentIds();
    }

    private static Entity manualMerge(MergeConflict conflict, ConflictResolution resolution, Instant now) {
        if (resolution == null || resolution.parameters().isEmpty()) {
            throw new InvalidOperationException(
                    "manual_merge for '" + conflict.entityId() + "' needs merged parameters",
                    Map.of("entity_id", conflict.entityId()));
        }
        Entity template = conflict.target() != null ? conflict.target() : conflict.source();
        Map<String, Double> params = new HashMap<>(template.parameters());
        params.putAll(resolution.parameters());
        return new Entity(template.id(), template.type(), EntityParameters.normalize(template.type(), params),
                template.version(), template.parentIds(), template.createdBy(), template.createdAt(), now);
    }

    private static final class PlanBuilder {

        private final Instant now;
        private final List<EntityChange> changes = new ArrayList<>();
        private final List<MergeConflict> resolved = new ArrayList<>();
        private final List<MergeConflict> unresolved = new ArrayList<>();
        private int added;
        private int modified;
        private int deleted;

        private PlanBuilder(Instant now) {
            this.now = now;
        }

        /** Records that the target's version {@code before} becomes {@code after}. */
        private void write(Entity before, Entity after) {
            if (before == null && after == null) {
                return;
            }
            String id = before != null ? before.id() : after.id();
            Entity stamped = after;
            if (before == null) {
                added++;
            } else if (after == null) {
                deleted++;
            } else {
                modified++;
                stamped = after.withVersion(Math.max(before.version(), after.version()) + 1, now);
            }
            changes.add(new EntityChange(id, before, stamped));
        }

        private MergePlan build() {
            return new MergePlan(changes, added, modified, deleted, resolved, unresolved);
        }
    }
}
