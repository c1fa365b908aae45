package com.cadforge.core.entity;

import java.util.List;

/**
 * A deleted entity and the constraints removed with it.
 */
public record EntityDeletion(String entityId, List<String> removedConstraintIds) {}
