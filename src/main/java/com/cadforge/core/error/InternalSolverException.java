package com.cadforge.core.error;

import java.util.Map;

public class InternalSolverException extends CadforgeException {

    public InternalSolverException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL_SOLVER_ERROR, message, Map.of(), cause);
    }
}
