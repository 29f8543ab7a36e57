package com.creature.cache.store;

/**
 * Hands out {@link StoreConnection}s, one per logical read or write.
 * Callers release with try-with-resources.
 */
public interface StoreConnectionProvider extends AutoCloseable {

    /**
     * Acquires a connection.
     *
     * @return an open connection
     * @throws StoreUnavailableException if no connection can be obtained
     */
    StoreConnection acquire();

    /**
     * Dialect of the underlying database.
     */
    SqlDialect getDialect();

    /**
     * Current pool statistics.
     */
    PoolStats getStats();

    /**
     * Closes the provider and all connections it manages.
     */
    @Override
    void close();
}
