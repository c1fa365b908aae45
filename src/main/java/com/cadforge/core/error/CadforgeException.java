package com.cadforge.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for every failure the core reports to agents. Carries a
 * {@link ErrorKind} and a structured details map that transports serialise
 * verbatim.
 */
public abstract class CadforgeException extends RuntimeException {

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected CadforgeException(ErrorKind kind, String message, Map<String, ?> details) {
        super(message);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    protected CadforgeException(ErrorKind kind, String message, Map<String, ?> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }
}
