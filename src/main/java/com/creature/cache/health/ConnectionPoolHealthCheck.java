package com.creature.cache.health;

import com.creature.cache.store.PoolStats;
import com.creature.cache.store.StoreConnectionProvider;

/**
 * Reports store pool utilization. DEGRADED at high usage or when threads are
 * queueing for a connection.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final StoreConnectionProvider provider;

    public ConnectionPoolHealthCheck(StoreConnectionProvider provider) {
        this.provider = provider;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        PoolStats stats = provider.getStats();
        double utilization = stats.utilization();

        HealthStatus base;
        if (stats.awaitingThreads() > 0) {
            base = HealthStatus.degraded(stats.awaitingThreads() + " threads waiting for a connection");
        } else if (utilization >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded("Connection pool usage high: " +
                    String.format("%.0f%%", utilization * 100));
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("totalConnections", stats.totalConnections())
                .withDetail("activeConnections", stats.activeConnections())
                .withDetail("idleConnections", stats.idleConnections())
                .withDetail("awaitingThreads", stats.awaitingThreads())
                .withDetail("maxPoolSize", stats.maxPoolSize());
    }
}
