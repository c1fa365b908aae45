package com.cadforge.core.error;

import java.util.Map;

public class InvalidEntityException extends CadforgeException {

    public InvalidEntityException(String message) {
        super(ErrorKind.INVALID_ENTITY, message, Map.of());
    }

    public InvalidEntityException(String message, Map<String, ?> details) {
        super(ErrorKind.INVALID_ENTITY, message, details);
    }
}
