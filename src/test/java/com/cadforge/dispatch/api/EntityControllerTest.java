package com.cadforge.dispatch.api;

import com.cadforge.core.entity.EntityService;
import com.cadforge.core.error.EntityNotFoundException;
import com.cadforge.core.error.InvalidEntityException;
import com.cadforge.core.error.WorkspaceNotFoundException;
import com.cadforge.core.model.Entity;
import com.cadforge.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(EntityController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class EntityControllerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EntityService entityService;

    private static Entity point(String id) {
        return new Entity(id, EntityType.POINT, Map.of("x", 1.0, "y", 2.0, "z", 0.0), 1,
                List.of("main:sketch_00000001"), "agent-a", NOW, NOW);
    }

    // ── POST /api/v1/workspaces/{id}/entities ────────────────────────

    @Test
    @DisplayName("POST /entities returns 201 with the created entity")
    void createEntity() throws Exception {
        when(entityService.create(eq("main"), eq(EntityType.POINT), anyMap(), any(), eq("agent-a")))
                .thenReturn(point("main:point_00000001"));

        mockMvc.perform(post("/api/v1/workspaces/main/entities")
                        .header("X-Agent-Id", "agent-a")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"point","parameters":{"x":1.0,"y":2.0},"parent_ids":["main:sketch_00000001"]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.entity_id").value("main:point_00000001"))
                .andExpect(jsonPath("$.type").value("point"))
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.parent_ids[0]").value("main:sketch_00000001"))
                .andExpect(jsonPath("$.created_at").value("2026-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("POST /entities with an unknown type returns 400 INVALID_ENTITY")
    void createUnknownType() throws Exception {
        mockMvc.perform(post("/api/v1/workspaces/main/entities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"spline","parameters":{}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ENTITY"));
    }

    @Test
    @DisplayName("POST /entities with invalid parameters returns 400 with details")
    void createInvalidParameters() throws Exception {
        when(entityService.create(eq("main"), eq(EntityType.CIRCLE), anyMap(), isNull(), eq("anonymous")))
                .thenThrow(new InvalidEntityException("Circle radius must be positive", Map.of("r", -1.0)));

        mockMvc.perform(post("/api/v1/workspaces/main/entities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"circle","parameters":{"r":-1.0}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_ENTITY"))
                .andExpect(jsonPath("$.message").value("Circle radius must be positive"))
                .andExpect(jsonPath("$.details.r").value(-1.0))
                .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    @DisplayName("malformed JSON returns 400 BAD_REQUEST")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/workspaces/main/entities")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    // ── GET ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("GET /entities/{id} for a missing entity returns 404 ENTITY_NOT_FOUND")
    void queryMissing() throws Exception {
        when(entityService.query("main", "main:point_nope"))
                .thenThrow(new EntityNotFoundException("main", "main:point_nope"));

        mockMvc.perform(get("/api/v1/workspaces/main/entities/main:point_nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ENTITY_NOT_FOUND"))
                .andExpect(jsonPath("$.code").value(-32001))
                .andExpect(jsonPath("$.suggestion").isNotEmpty());
    }

    @Test
    @DisplayName("GET /entities in an unknown workspace returns 404 WORKSPACE_NOT_FOUND")
    void listUnknownWorkspace() throws Exception {
        when(entityService.list("ghost", null)).thenThrow(new WorkspaceNotFoundException("ghost"));

        mockMvc.perform(get("/api/v1/workspaces/ghost/entities"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("WORKSPACE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /entities?type= filters by type")
    void listByType() throws Exception {
        when(entityService.list("main", EntityType.POINT))
                .thenReturn(List.of(point("main:point_00000001"), point("main:point_00000002")));

        mockMvc.perform(get("/api/v1/workspaces/main/entities").param("type", "point"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].entity_id").value("main:point_00000002"));
    }
}
