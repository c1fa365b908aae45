package com.cadforge.core.constraint;

import java.util.List;

/**
 * DOF accounting of one connected component.
 */
public record ComponentDof(
    List<String> entityIds,
    int totalDof,
    int dofRemoved,
    int dofRemaining
) {}
