package com.cadforge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Cadforge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkspace(String workspaceId, String agentId) {
        MDC.put("workspaceId", workspaceId);
        if (agentId != null) {
            MDC.put("agentId", agentId);
        }
    }

    public static void setOperation(String workspaceId, String agentId, String operation) {
        setWorkspace(workspaceId, agentId);
        MDC.put("operation", operation);
    }

    public static void clear() {
        MDC.remove("workspaceId");
        MDC.remove("agentId");
        MDC.remove("operation");
    }
}
