package com.cadforge.dispatch.api;

import com.cadforge.core.constraint.ApplyOutcome;
import com.cadforge.core.constraint.ConstraintService;
import com.cadforge.core.model.Constraint;
import com.cadforge.dispatch.Payloads;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;


/**
 * REST controller for the constraint graph of one workspace.
 */
@RestController
@RequestMapping("/api/v1/workspaces/{workspaceId}/constraints")
public class ConstraintController {

    private final ConstraintService constraintService;

    public ConstraintController(ConstraintService constraintService) {
        this.constraintService = constraintService;
    }

    @PostMapping
    public ResponseEntity<ApplyResponse> apply(@PathVariable String workspaceId,
                                               @RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId,
                                               @RequestBody ConstraintRequest request) {
        ApplyOutcome outcome = constraintService.apply(workspaceId,
                Payloads.constraintType(request.constraintType()),
                request.entityIds(), request.parameters(), request.tolerance(), agentId);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApplyResponse.from(outcome));
    }

    @DeleteMapping("/{constraintId}")
    public ConstraintResponse remove(@PathVariable String workspaceId,
                                     @PathVariable String constraintId,
                                     @RequestHeader(value = EntityController.AGENT_HEADER, defaultValue = "anonymous") String agentId) {
        Constraint removed = constraintService.remove(workspaceId, constraintId, agentId);
        return ConstraintResponse.from(removed);
    }

    /**
     * GET /api/v1/workspaces/{workspaceId}/constraints. Status report, whole workspace or one sketch.
     */
    @GetMapping
    public ConstraintReportResponse status(@PathVariable String workspaceId,
                                           @RequestParam(name = "sketch_id", required = false) String sketchId) {
        return ConstraintReportResponse.from(constraintService.status(workspaceId, sketchId));
    }
}
