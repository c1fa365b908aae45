package com.cadforge.dispatch.api;

import com.cadforge.core.entity.EntityService;
import com.cadforge.core.model.Entity;
import com.cadforge.dispatch.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for entities of one workspace.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/entities")
public class EntityController {

    private static final Logger log = LoggerFactory.getLogger(EntityController.class);

    static final String AGENT_HEADER = "X-Agent-Id";

    private final EntityService entityService;

    public EntityController(EntityService entityService) {
        this.entityService = entityService;
    }

    /**
     * POST /api/v1/workspaces/{workspaceId}/entities. Create an entity.
     */
    @PostMapping
    public ResponseEntity<EntityResponse> create(@PathVariable String workspaceId,
                                                 @RequestHeader(value = AGENT_HEADER, defaultValue = "anonymous") String agentId,
                                                 @RequestBody EntityRequest request) {
        Entity entity = entityService.create(workspaceId, Payloads.entityType(request.type()),
                request.parameters() == null ? Map.of() : request.parameters(),
                request.parentIds(), agentId);
        log.debug("Agent '{}' created {}", agentId, entity.id());
        return ResponseEntity.status(HttpStatus.CREATED).body(EntityResponse.from(entity));
    }

    /**
     * GET /api/v1/workspaces/{workspaceId}/entities. List entities, optionally by type.
     */
    @GetMapping
    public List<EntityResponse> list(@PathVariable String workspaceId,
                                     @RequestParam(required = false) String type) {
        return entityService.list(workspaceId, Payloads.entityTypeOrNull(type)).stream()
                .map(EntityResponse::from)
                .toList();
    }

    /**
     * GET /api/v1/workspaces/{workspaceId}/entities/{entityId}. Entity with derived properties.
     */
    @GetMapping("/{entityId}")
    public EntityDetailsResponse query(@PathVariable String workspaceId, @PathVariable String entityId) {
        return EntityDetailsResponse.from(entityService.query(workspaceId, entityId));
    }

    /**
     * PATCH /api/v1/workspaces/{workspaceId}/entities/{entityId}. Update parameters and propagate.
     */
    @PatchMapping("/{entityId}")
    public EntityUpdateResponse update(@PathVariable String workspaceId,
                                       @PathVariable String entityId,
                                       @RequestHeader(value = AGENT_HEADER, defaultValue = "anonymous") String agentId,
                                       @RequestBody EntityUpdateRequest request) {
        return EntityUpdateResponse.from(entityService.update(workspaceId, entityId, request.parameters(), agentId));
    }

    /**
     * DELETE /api/v1/workspaces/{workspaceId}/entities/{entityId}. Delete an entity and its constraints.
     */
    @DeleteMapping("/{entityId}")
    public EntityDeletionResponse delete(@PathVariable String workspaceId,
                                         @PathVariable String entityId,
                                         @RequestHeader(value = AGENT_HEADER, defaultValue = "anonymous") String agentId) {
        return EntityDeletionResponse.from(entityService.delete(workspaceId, entityId, agentId));
    }
}
