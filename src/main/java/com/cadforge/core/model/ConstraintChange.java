package com.cadforge.core.model;

import java.io.Serializable;

/**
 * Before/after snapshots of one constraint touched by an operation. A null
 * {@code before} marks an application, a null {@code after} a removal.
 */
public record ConstraintChange(
    String constraintId,
    Constraint before,
    Constraint after
) implements Serializable {}
