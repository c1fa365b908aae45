package com.cadforge.core.model;

import java.io.Serializable;

/**
 * Before/after snapshots of one entity touched by an operation. A null
 * {@code before} marks a creation, a null {@code after} a deletion.
 */
public record EntityChange(
    String entityId,
    Entity before,
    Entity after
) implements Serializable {}
