package com.cadforge.core.entity;

import com.cadforge.core.constraint.PropagationResult;
import com.cadforge.core.model.Entity;

/**
 * A new entity version and the constraint re-evaluation it triggered.
 */
public record EntityUpdate(Entity entity, PropagationResult propagation) {}
