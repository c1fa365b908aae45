package com.cadforge.core.workspace;

import com.cadforge.core.model.BranchStatus;
import com.cadforge.core.model.Workspace;

/**
 * A workspace with its derived state.
 *
 * @param workspace        workspace metadata
 * @param status           clean, modified or merged
 * @param entityCount      visible entities
 * @param constraintCount  constraints in the workspace graph
 * @param operationCount   records in the workspace log
 * @param localOperations  records since the last synchronisation point
 * @param baseHead         current head of the base log, 0 for the root
 * @param canMerge         whether the workspace can be merged into its base
 */
public record WorkspaceStatus(
    Workspace workspace,
    BranchStatus status,
    int entityCount,
    int constraintCount,
    long operationCount,
    long localOperations,
    long baseHead,
    boolean canMerge
) {}
