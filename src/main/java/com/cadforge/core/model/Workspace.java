package com.cadforge.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * An isolated branch of the model owned by one agent. The root workspace has
 * no base.
 *
 * @param id               {@code <agent>:<name>} for branches, the configured root id otherwise
 * @param name             human-readable name
 * @param baseWorkspaceId  workspace this one was forked from; null for the root
 * @param divergencePoint  base operation sequence at fork time or at the last merge with the base
 * @param syncedSequence   own operation sequence at fork time or at the last merge
 * @param ownerAgentId     agent that created the workspace
 * @param createdAt        creation time
 * @param merged           whether the last merge consumed every local operation
 */
public record Workspace(
    String id,
    String name,
    String baseWorkspaceId,
    long divergencePoint,
    long syncedSequence,
    String ownerAgentId,
    Instant createdAt,
    boolean merged
) implements Serializable {

    public boolean isRoot() {
        return baseWorkspaceId == null;
    }

    /**
     * Status given the current head of this workspace's operation log.
     */
    public BranchStatus statusAt(long head) {
        if (head > syncedSequence) {
            return BranchStatus.MODIFIED;
        }
        return merged ? BranchStatus.MERGED : BranchStatus.CLEAN;
    }

    public Workspace withDivergencePoint(long newDivergencePoint) {
        return new Workspace(id, name, baseWorkspaceId, Math.max(divergencePoint, newDivergencePoint),
                syncedSequence, ownerAgentId, createdAt, merged);
    }

    public Workspace markMerged(long head) {
        return new Workspace(id, name, baseWorkspaceId, divergencePoint, head, ownerAgentId, createdAt, true);
    }
}
