package com.cadforge.core.error;

import java.util.Map;

/**
 * The constraint type does not fit the referenced entities or its parameters.
 */
public class InvalidConstraintException extends CadforgeException {

    public InvalidConstraintException(String message) {
        super(ErrorKind.INVALID_CONSTRAINT, message, Map.of());
    }

    public InvalidConstraintException(String message, Map<String, ?> details) {
        super(ErrorKind.INVALID_CONSTRAINT, message, details);
    }
}
