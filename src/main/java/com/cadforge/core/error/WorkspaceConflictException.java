package com.cadforge.core.error;

import com.cadforge.core.model.MergeConflict;

import java.util.List;
import java.util.Map;

/**
 * A merge found conflicts without a resolution. The target workspace is untouched.
 */
public class WorkspaceConflictException extends CadforgeException {

    private final List<MergeConflict> conflicts;

    public WorkspaceConflictException(String sourceId, String targetId, List<MergeConflict> conflicts) {
        super(ErrorKind.WORKSPACE_CONFLICT,
                conflicts.size() + " unresolved conflict(s) merging '" + sourceId + "' into '" + targetId + "'",
                Map.of("source_workspace_id", sourceId,
                        "target_workspace_id", targetId,
                        "conflict_entity_ids", conflicts.stream().map(MergeConflict::entityId).toList()));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<MergeConflict> conflicts() {
        return conflicts;
    }
}
