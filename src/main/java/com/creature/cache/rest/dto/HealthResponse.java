package com.creature.cache.rest.dto;

import com.creature.cache.health.HealthStatus;

import java.util.Map;

/**
 * Response DTO for the aggregated health check.
 */
public record HealthResponse(String status, String message, Map<String, Object> checks) {

    public static HealthResponse from(HealthStatus status) {
        return new HealthResponse(status.status().name(), status.message(), status.details());
    }
}
