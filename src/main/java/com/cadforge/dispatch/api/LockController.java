package com.cadforge.dispatch.api;

import com.cadforge.core.coordination.LeaseLockService;
import com.cadforge.core.model.ResourceLock;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for lease locks on shared resources.
 */
@RestController
@RequestMapping("/api/v1/locks")
public class LockController {

    private final LeaseLockService leaseLockService;

    public LockController(LeaseLockService leaseLockService) {
        this.leaseLockService = leaseLockService;
    }

    /**
     * POST /api/v1/locks. Acquire or renew a lease. 423 when another holder has it.
     */
    @PostMapping
    public LockResponse.Granted acquire(@RequestBody LockRequest request) {
        ResourceLock lock = leaseLockService.acquire(request.resourceType(), request.resourceName(),
                request.holder(), request.sessionId(), request.ttlSeconds());
        return LockResponse.Granted.from(lock);
    }

    @GetMapping
    public List<LockResponse> list() {
        return leaseLockService.list().stream().map(LockResponse::from).toList();
    }

    @GetMapping("/{resourceType}/{resourceName}")
    public ResponseEntity<LockResponse> status(@PathVariable String resourceType,
                                               @PathVariable String resourceName) {
        return leaseLockService.status(resourceType, resourceName)
                .map(lock -> ResponseEntity.ok(LockResponse.from(lock)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * DELETE /api/v1/locks/{resourceType}/{resourceName}?holder=. Idempotent release.
     */
    @DeleteMapping("/{resourceType}/{resourceName}")
    public LockResponse.Released release(@PathVariable String resourceType,
                                         @PathVariable String resourceName,
                                         @RequestParam String holder) {
        return new LockResponse.Released(leaseLockService.release(resourceType, resourceName, holder));
    }
}
