package com.creature.cache.store;

/**
 * Statistics for a {@link StoreConnectionProvider}.
 *
 * @param totalConnections   connections managed by the pool (active + idle)
 * @param activeConnections  connections currently in use
 * @param idleConnections    connections available for use
 * @param awaitingThreads    threads waiting for a connection
 * @param maxPoolSize        configured upper bound
 */
public record PoolStats(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        int awaitingThreads,
        int maxPoolSize
) {

    /**
     * Fraction of the maximum pool size in use, 0.0 to 1.0.
     */
    public double utilization() {
        return maxPoolSize > 0 ? (double) activeConnections / maxPoolSize : 0.0;
    }

    public static PoolStats empty(int maxPoolSize) {
        return new PoolStats(0, 0, 0, 0, maxPoolSize);
    }
}
