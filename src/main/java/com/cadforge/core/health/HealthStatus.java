package com.cadforge.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of one component check.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    static HealthStatus degraded(String component, String detail) {
        return new HealthStatus(component, Status.DEGRADED, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * DOWN if any component is down, DEGRADED if any is degraded, UP otherwise.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        Status result = Status.UP;
        for (HealthStatus check : checks) {
            if (check.isDown()) {
                return Status.DOWN;
            }
            if (check.status() == Status.DEGRADED) {
                result = Status.DEGRADED;
            }
        }
        return result;
    }
}
