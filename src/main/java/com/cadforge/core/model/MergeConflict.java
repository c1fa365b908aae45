package com.cadforge.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An entity changed incompatibly on both sides of a merge.
 *
 * @param entityId            conflicting entity
 * @param type                kind of conflict
 * @param conflictingParameters parameters changed to different values on both sides (empty for delete/modify)
 * @param base                version at the merge base, null if the entity did not exist there
 * @param source              version in the source workspace, null if deleted there
 * @param target              version in the target workspace, null if deleted there
 * @param resolutionOptions   ways the conflict may be resolved
 */
public record MergeConflict(
    String entityId,
    ConflictType type,
    List<String> conflictingParameters,
    Entity base,
    Entity source,
    Entity target,
    List<ResolutionOption> resolutionOptions
) implements Serializable {

    public MergeConflict {
        conflictingParameters = List.copyOf(conflictingParameters);
        resolutionOptions = List.copyOf(resolutionOptions);
    }
}
