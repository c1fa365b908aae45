package com.cadforge.core.error;

/**
 * Failure categories surfaced to agents, with their JSON-RPC code, HTTP status,
 * retry hint and a short suggestion for recovering.
 */
public enum ErrorKind {
    ENTITY_NOT_FOUND(-32001, 404, false,
            "Check the entity id and the workspace it lives in"),
    CONSTRAINT_CONFLICT(-32002, 409, false,
            "Remove the conflicting constraint first using constraint.remove"),
    INVALID_CONSTRAINT(-32004, 400, false,
            "Check the constraint type against the referenced entity types and parameters"),
    INVALID_OPERATION(-32005, 400, false,
            "Check the workspace state before retrying"),
    WORKSPACE_CONFLICT(-32007, 409, true,
            "Retry workspace.merge with resolutions or a keep_source/keep_target strategy"),
    BASE_NOT_FOUND(-32013, 404, false,
            "Create the base workspace first or use the root workspace"),
    WORKSPACE_NOT_FOUND(-32014, 404, false,
            "Use workspace.list to see available workspaces"),
    ALREADY_LOCKED(-32015, 423, true,
            "Wait for the lease to expire or for the holder to release it"),
    INVALID_ENTITY(-32603, 400, false,
            "Check the entity parameters: values must be finite and dimensions positive"),
    STORAGE_FAILURE(-32603, 500, true,
            "Check the lock store connection"),
    INTERNAL_SOLVER_ERROR(-32099, 500, false,
            "Report the failing operation with its parameters");

    private final int code;
    private final int httpStatus;
    private final boolean retryable;
    private final String suggestion;

    ErrorKind(int code, int httpStatus, boolean retryable, String suggestion) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
        this.suggestion = suggestion;
    }

    public int code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }

    public String suggestion() {
        return suggestion;
    }
}
