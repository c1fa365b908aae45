package com.cadforge.dispatch.api;

import com.cadforge.core.health.HealthStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Overall health plus one entry per component, keyed by component name.
 */
public record HealthResponse(String status, Map<String, Check> components) {

    public static HealthResponse from(List<HealthStatus> checks) {
        Map<String, Check> components = new LinkedHashMap<>();
        for (HealthStatus check : checks) {
            components.put(check.component(), Check.from(check));
        }
        return new HealthResponse(HealthStatus.overall(checks).name(), components);
    }

    public record Check(
        String component,
        String status,
        String detail,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, String> metadata
    ) {

        public static Check from(HealthStatus check) {
            return new Check(check.component(), check.status().name(), check.detail(), check.metadata());
        }
    }
}
