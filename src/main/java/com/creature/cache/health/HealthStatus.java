package com.creature.cache.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health of one cache component, or of the whole cache once {@link HealthCheckRegistry}
 * has aggregated its checks.
 *
 * <p>DEGRADED still serves lookups, possibly without the store. Only DOWN means
 * lookups cannot be answered at all.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    public enum Status {
        UP,
        DEGRADED,
        DOWN;

        public boolean isWorseThan(Status other) {
            return compareTo(other) > 0;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status is required");
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    /**
     * The component is impaired but lookups are still answered.
     */
    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * The component prevents lookups from being answered.
     */
    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(details);
        newDetails.put(key, value);
        return new HealthStatus(status, message, newDetails);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * Whether lookups are still answered in this state.
     */
    public boolean isServing() {
        return status != Status.DOWN;
    }

    /**
     * Status, message and details as one entry of an aggregated report.
     */
    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.name());
        summary.put("message", message);
        summary.put("details", details);
        return summary;
    }
}
