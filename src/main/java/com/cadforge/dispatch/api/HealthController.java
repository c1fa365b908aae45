package com.cadforge.dispatch.api;

import com.cadforge.core.health.HealthCheckService;
import com.cadforge.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for component health.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    /**
     * GET /api/v1/health. 503 when a component is DOWN; a DEGRADED system still answers 200.
     */
    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        List<HealthStatus> checks = healthCheckService != null
                ? healthCheckService.checkAll()
                : List.of(new HealthStatus("health", HealthStatus.Status.DOWN, "Health check service not available", Map.of()));
        HealthResponse body = HealthResponse.from(checks);
        HttpStatus httpStatus = HealthStatus.Status.DOWN.name().equals(body.status())
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(httpStatus).body(body);
    }
}
