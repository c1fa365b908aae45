package com.cadforge.core.model;

import java.util.Locale;

/**
 * Kinds of mutation recorded in a workspace's operation log.
 */
public enum OperationType {
    ENTITY_CREATE,
    ENTITY_UPDATE,
    ENTITY_DELETE,
    CONSTRAINT_APPLY,
    CONSTRAINT_REMOVE,
    MERGE,
    UNDO;

    /** Lower-case wire name. */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
