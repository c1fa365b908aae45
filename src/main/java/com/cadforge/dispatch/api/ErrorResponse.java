package com.cadforge.dispatch.api;

import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.error.CadforgeException;
import com.cadforge.core.error.WorkspaceConflictException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body of the REST API. The same details, retry hint and suggestion
 * travel as {@link Data} in JSON-RPC error objects.
 */
public record ErrorResponse(
    String error,
    int code,
    String message,
    Map<String, Object> details,
    boolean retryable,
    String suggestion
) {

    public static ErrorResponse from(CadforgeException e) {
        Data data = Data.from(e);
        return new ErrorResponse(e.kind().name(), e.kind().code(), e.getMessage(),
                data.details(), data.retryable(), data.suggestion());
    }

    /**
     * Structured error data. Merge conflicts and lock holders are expanded in full.
     */
    public record Data(String kind, Map<String, Object> details, boolean retryable, String suggestion) {

        public static Data from(CadforgeException e) {
            Map<String, Object> details = new LinkedHashMap<>(e.details());
            if (e instanceof WorkspaceConflictException conflict) {
                details.put("conflicts", conflict.conflicts().stream().map(ConflictResponse::from).toList());
            } else if (e instanceof AlreadyLockedException locked) {
                details.put("lock", LockResponse.from(locked.heldLock()));
            }
            return new Data(e.kind().name(), details, e.kind().retryable(), e.kind().suggestion());
        }
    }
}
