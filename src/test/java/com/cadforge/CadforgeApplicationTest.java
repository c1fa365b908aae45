package com.cadforge;

import com.cadforge.core.coordination.JdbcLeaseLockStore;
import com.cadforge.core.coordination.LeaseLockStore;
import com.cadforge.core.health.HealthCheckService;
import com.cadforge.core.health.HealthStatus;
import com.cadforge.core.workspace.WorkspaceService;
import com.cadforge.dispatch.rpc.RpcDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "spring.datasource.url=jdbc:h2:mem:cadforge-context;DB_CLOSE_DELAY=-1")
class CadforgeApplicationTest {

    @Autowired
    private WorkspaceService workspaceService;

    @Autowired
    private LeaseLockStore leaseLockStore;

    @Autowired
    private HealthCheckService healthCheckService;

    @Autowired
    private RpcDispatcher rpcDispatcher;

    @Test
    @DisplayName("context starts with the root workspace and a JDBC lease store")
    void contextLoads() {
        assertEquals("main", workspaceService.rootId());
        assertEquals("main", workspaceService.status("main").workspace().id());
        assertInstanceOf(JdbcLeaseLockStore.class, leaseLockStore);
        assertTrue(healthCheckService.checkAll().stream()
                .allMatch(check -> check.status() == HealthStatus.Status.UP));
    }

    @Test
    @DisplayName("the dispatcher is wired to the live services")
    void dispatcherWired() {
        String response = rpcDispatcher.handle(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"workspace.status\",\"params\":{\"workspace_id\":\"main\"}}",
                "agent-a");

        assertTrue(response.contains("\"workspace_id\":\"main\""), response);
    }
}
