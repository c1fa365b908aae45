package com.cadforge.dispatch.api;

import com.cadforge.core.coordination.LeaseLockService;
import com.cadforge.core.error.AlreadyLockedException;
import com.cadforge.core.error.InvalidOperationException;
import com.cadforge.core.model.ResourceLock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LockController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class LockControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private LeaseLockService leaseLockService;

    private static ResourceLock lock(String holder) {
        return new ResourceLock("sketch", "s1", holder, "sess-1", NOW, NOW.plusSeconds(30));
    }

    @Test
    @DisplayName("POST /locks grants a lease")
    void acquire() throws Exception {
        when(leaseLockService.acquire("sketch", "s1", "agent-a", "sess-1", 30L)).thenReturn(lock("agent-a"));

        mockMvc.perform(post("/api/v1/locks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resource_type":"sketch","resource_name":"s1","holder":"agent-a",
                                 "session_id":"sess-1","ttl_seconds":30}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.granted").value(true))
                .andExpect(jsonPath("$.expires_at").value("2026-01-01T00:00:30Z"));
    }

    @Test
    @DisplayName("POST /locks on a resource held by someone else returns 423")
    void acquireContended() throws Exception {
        when(leaseLockService.acquire(eq("sketch"), eq("s1"), eq("agent-b"), isNull(), isNull()))
                .thenThrow(new AlreadyLockedException(lock("agent-a")));

        mockMvc.perform(post("/api/v1/locks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resource_type":"sketch","resource_name":"s1","holder":"agent-b"}
                                """))
                .andExpect(status().is(423))
                .andExpect(jsonPath("$.error").value("ALREADY_LOCKED"))
                .andExpect(jsonPath("$.code").value(-32015))
                .andExpect(jsonPath("$.details.lock.holder").value("agent-a"));
    }

    @Test
    @DisplayName("POST /locks with a TTL out of bounds returns 400")
    void acquireBadTtl() throws Exception {
        when(leaseLockService.acquire("sketch", "s1", "agent-a", null, 0L))
                .thenThrow(new InvalidOperationException("ttl_seconds must be between 1 and 3600"));

        mockMvc.perform(post("/api/v1/locks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"resource_type":"sketch","resource_name":"s1","holder":"agent-a","ttl_seconds":0}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /locks/{type}/{name} returns 404 when the resource is free")
    void statusFree() throws Exception {
        when(leaseLockService.status("sketch", "s1")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/locks/sketch/s1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /locks/{type}/{name} reports whether a lease was released")
    void release() throws Exception {
        when(leaseLockService.release("sketch", "s1", "agent-a")).thenReturn(true);

        mockMvc.perform(delete("/api/v1/locks/sketch/s1").param("holder", "agent-a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.released").value(true));
    }
}
