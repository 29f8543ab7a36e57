package com.creature.cache.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and reports the worst status among them.
 * The store being down only degrades the cache; see {@link StoreHealthCheck}.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";
        Map<String, Object> results = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                result = HealthStatus.down("Check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            results.put(check.getName(), result.summary());
            if (result.status().isWorseThan(worstStatus)) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, results);
    }

    public int size() {
        return checks.size();
    }
}
