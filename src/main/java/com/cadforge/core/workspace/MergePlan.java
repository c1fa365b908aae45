package com.cadforge.core.workspace;

import com.cadforge.core.model.EntityChange;
import com.cadforge.core.model.MergeConflict;

import java.util.List;

/**
 * Entity writes a merge would apply to its target, before anything is committed.
 *
 * @param changes     target version before and merged version after, per changed entity
 * @param added       entities that would be created in the target
 * @param modified    entities that would get a new target version
 * @param deleted     entities that would be tombstoned in the target
 * @param resolved    conflicts settled by the strategy or an explicit resolution
 * @param unresolved  conflicts still needing a decision; non-empty means the merge must abort
 */
public record MergePlan(
    List<EntityChange> changes,
    int added,
    int modified,
    int deleted,
    List<MergeConflict> resolved,
    List<MergeConflict> unresolved
) {

    public MergePlan {
        changes = List.copyOf(changes);
        resolved = List.copyOf(resolved);
        unresolved = List.copyOf(unresolved);
    }

    public boolean hasConflicts() {
        return !unresolved.isEmpty();
    }
}
