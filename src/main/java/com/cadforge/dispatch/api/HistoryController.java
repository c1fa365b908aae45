package com.cadforge.dispatch.api;

import com.cadforge.core.oplog.HistoryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for a workspace's operation log.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/history")
public class HistoryController {

    private final HistoryService historyService;

    public HistoryController(HistoryService historyService) {
        this.historyService = historyService;
    }

    @GetMapping
    public List<OperationResponse> list(@PathVariable String workspaceId,
                                        @RequestParam(defaultValue = "50") int limit,
                                        @RequestParam(defaultValue = "0") int offset) {
        return historyService.list(workspaceId, limit, offset).stream().map(OperationResponse::from).toList();
    }

    @PostMapping("/undo")
    public UndoResponse undo(@PathVariable String workspaceId,
                             @RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId) {
        return UndoResponse.from(historyService.undo(workspaceId, agentId));
    }
}
