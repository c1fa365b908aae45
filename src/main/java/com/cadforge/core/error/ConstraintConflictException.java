package com.cadforge.core.error;

import java.util.Map;

/**
 * A new constraint contradicts an existing one or would remove more degrees
 * of freedom than its component has left. The constraint graph is unchanged.
 */
public class ConstraintConflictException extends CadforgeException {

    public ConstraintConflictException(String message, Map<String, ?> details) {
        super(ErrorKind.CONSTRAINT_CONFLICT, message, details);
    }
}
