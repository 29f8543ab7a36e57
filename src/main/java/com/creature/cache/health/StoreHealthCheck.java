package com.creature.cache.health;

import com.creature.cache.store.StoreConnection;
import com.creature.cache.store.StoreConnectionProvider;
import com.creature.cache.store.StoreException;

/**
 * Checks that a store connection can be acquired and validated.
 * An unreachable store is DEGRADED rather than DOWN: lookups still work
 * through the remote source, only uncached.
 */
public class StoreHealthCheck implements HealthCheck {

    private final StoreConnectionProvider provider;

    public StoreHealthCheck(StoreConnectionProvider provider) {
        this.provider = provider;
    }

    @Override
    public String getName() {
        return "store";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        try (StoreConnection connection = provider.acquire()) {
            boolean valid = connection.isValid();
            long latencyMs = System.currentTimeMillis() - startMs;
            HealthStatus base = valid
                    ? HealthStatus.up()
                    : HealthStatus.degraded("Store connection failed validation");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("dialect", provider.getDialect().name());
        } catch (StoreException e) {
            return HealthStatus.degraded("Store unreachable, serving uncached: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
