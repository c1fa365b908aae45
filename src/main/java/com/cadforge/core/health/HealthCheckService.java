package com.cadforge.core.health;

import com.cadforge.core.coordination.LeaseLockStore;
import com.cadforge.core.workspace.WorkspaceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks the pieces agents depend on: the workspace registry (the root must
 * exist), the lease store and, when configured, the database behind it.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final WorkspaceRegistry registry;
    private final LeaseLockStore lockStore;
    private final DataSource dataSource;

    public HealthCheckService(
            @Autowired(required = false) WorkspaceRegistry registry,
            @Autowired(required = false) LeaseLockStore lockStore,
            @Autowired(required = false) DataSource dataSource) {
        this.registry = registry;
        this.lockStore = lockStore;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkWorkspaces());
        results.add(checkLockStore());
        results.add(checkDatabase());
        results.stream().filter(HealthStatus::isDown)
                .forEach(check -> log.warn("Health check '{}' is down: {}", check.component(), check.detail()));
        return results;
    }

    private HealthStatus checkWorkspaces() {
        if (registry == null) {
            return HealthStatus.down("workspaces",
                    "Workspace registry not available", Map.of());
        }
        int count = registry.all().size();
        if (count == 0) {
            return HealthStatus.down("workspaces",
                    "Root workspace not initialized", Map.of());
        }
        return HealthStatus.up("workspaces",
                count + " workspace(s) registered", Map.of("count", String.valueOf(count)));
    }

    private HealthStatus checkLockStore() {
        if (lockStore == null) {
            return HealthStatus.down("locks",
                    "No lock store configured", Map.of());
        }
        if (lockStore.isAvailable()) {
            return HealthStatus.up("locks",
                    lockStore.describe() + " available", Map.of("store", lockStore.describe()));
        }
        return HealthStatus.down("locks",
                lockStore.describe() + " unreachable", Map.of("store", lockStore.describe()));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return HealthStatus.degraded("database", "No DataSource configured, leases are process-local");
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("database",
                        "Database connection valid", Map.of());
            }
            return HealthStatus.down("database",
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return HealthStatus.down("database",
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}
