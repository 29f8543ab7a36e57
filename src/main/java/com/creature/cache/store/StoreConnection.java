package com.creature.cache.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A single connection to the relational store, held for one logical operation.
 * Closing the connection releases it back to wherever it came from.
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * Runs a query expected to match at most one row.
     *
     * @param sql    SQL with {@code ?} placeholders
     * @param params positional parameters
     * @return the first row keyed by lower-cased column label, or empty if none matched
     * @throws StoreException if the query fails
     */
    Optional<Map<String, Object>> queryOne(String sql, List<Object> params);

    /**
     * Runs a statement that modifies the store.
     *
     * @param sql    SQL with {@code ?} placeholders
     * @param params positional parameters
     * @return affected row count
     * @throws StoreException if the statement fails
     */
    int execute(String sql, List<Object> params);

    /**
     * Checks whether the underlying connection is still usable.
     */
    boolean isValid();

    /**
     * Releases the connection. Never throws.
     */
    @Override
    void close();
}
