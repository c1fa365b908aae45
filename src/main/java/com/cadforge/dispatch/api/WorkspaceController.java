package com.cadforge.dispatch.api;

import com.cadforge.core.model.ConflictResolution;
import com.cadforge.core.model.MergeResult;
import com.cadforge.core.model.Workspace;
import com.cadforge.core.workspace.WorkspaceService;
import com.cadforge.dispatch.Payloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for workspace lifecycle and merging.
 */
@RestController
@RequestMapping("/api/v1/workspaces")
public class WorkspaceController {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceController.class);

    private final WorkspaceService workspaceService;

    public WorkspaceController(WorkspaceService workspaceService) {
        this.workspaceService = workspaceService;
    }

    /**
     * POST /api/v1/workspaces. Fork a workspace for the calling agent.
     */
    @PostMapping
    public ResponseEntity<WorkspaceResponse> create(@RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId,
                                                    @RequestBody WorkspaceRequest request) {
        Workspace workspace = workspaceService.create(request.name(), request.baseWorkspaceId(), agentId);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkspaceResponse.from(workspace));
    }

    @GetMapping
    public List<WorkspaceStatusResponse> list() {
        return workspaceService.list().stream().map(WorkspaceStatusResponse::from).toList();
    }

    @GetMapping("/{workspaceId}")
    public WorkspaceStatusResponse status(@PathVariable String workspaceId) {
        return WorkspaceStatusResponse.from(workspaceService.status(workspaceId));
    }

    @DeleteMapping("/{workspaceId}")
    public WorkspaceResponse.Deleted delete(@PathVariable String workspaceId,
                                            @RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId) {
        return WorkspaceResponse.Deleted.from(workspaceService.delete(workspaceId, agentId));
    }

    /**
     * POST /api/v1/workspaces/{workspaceId}/merge. Merge this workspace into a target,
     * by default its base.
     */
    @PostMapping("/{workspaceId}/merge")
    public MergeResponse merge(@PathVariable String workspaceId,
                               @RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId,
                               @RequestBody MergeRequest request) {
        String target = request.targetWorkspaceId() != null
                ? request.targetWorkspaceId()
                : workspaceService.status(workspaceId).workspace().baseWorkspaceId();
        Map<String, ConflictResolution> resolutions = new LinkedHashMap<>();
        if (request.resolutions() != null) {
            request.resolutions().forEach((entityId, resolution) ->
                    resolutions.put(entityId, Payloads.resolution(resolution.option(), resolution.parameters())));
        }
        MergeResult result = workspaceService.merge(workspaceId, target,
                Payloads.mergeStrategy(request.strategy()), resolutions, agentId);
        log.debug("Merge {} -> {} by '{}' committed as {}", workspaceId, target, agentId, result.operationId());
        return MergeResponse.from(result);
    }
}
