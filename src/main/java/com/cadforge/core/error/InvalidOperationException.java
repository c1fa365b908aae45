package com.cadforge.core.error;

import java.util.Map;

public class InvalidOperationException extends CadforgeException {

    public InvalidOperationException(String message) {
        super(ErrorKind.INVALID_OPERATION, message, Map.of());
    }

    public InvalidOperationException(String message, Map<String, ?> details) {
        super(ErrorKind.INVALID_OPERATION, message, details);
    }
}
