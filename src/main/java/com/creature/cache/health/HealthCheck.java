package com.creature.cache.health;

/**
 * A single component check (store, pool, remote client) reporting a {@link HealthStatus}.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
