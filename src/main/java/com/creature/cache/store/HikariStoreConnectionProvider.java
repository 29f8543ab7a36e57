package com.creature.cache.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * {@link StoreConnectionProvider} backed by a HikariCP pool.
 *
 * <p>The pool starts even when the database is down; each failed
 * {@link #acquire()} then reports {@link StoreUnavailableException} after the
 * configured connection timeout.</p>
 */
public class HikariStoreConnectionProvider implements StoreConnectionProvider {
    private static final Logger log = LoggerFactory.getLogger(HikariStoreConnectionProvider.class);

    private final HikariDataSource dataSource;
    private final StoreConfig config;

    public HikariStoreConnectionProvider(StoreConfig config) {
        this.config = config;

        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.getJdbcUrl());
        hikari.setUsername(config.getUsername());
        hikari.setPassword(config.getPassword());
        hikari.setMaximumPoolSize(config.getMaxPoolSize());
        hikari.setMinimumIdle(config.getMinIdle());
        hikari.setConnectionTimeout(config.getConnectionTimeoutMillis());
        hikari.setIdleTimeout(config.getIdleTimeoutMillis());
        hikari.setAutoCommit(true);
        hikari.setInitializationFailTimeout(-1);
        hikari.setPoolName("creature-cache");

        this.dataSource = new HikariDataSource(hikari);
        log.info("Store connection pool initialized: {}", config);
    }

    @Override
    public StoreConnection acquire() {
        if (dataSource.isClosed()) {
            throw new StoreUnavailableException("Connection pool is closed");
        }
        try {
            Connection connection = dataSource.getConnection();
            return new JdbcStoreConnection(connection);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Could not acquire store connection: " + e.getMessage(), e);
        }
    }

    @Override
    public SqlDialect getDialect() {
        return config.getDialect();
    }

    @Override
    public PoolStats getStats() {
        HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
        if (pool == null) {
            return PoolStats.empty(config.getMaxPoolSize());
        }
        return new PoolStats(
                pool.getTotalConnections(),
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                pool.getThreadsAwaitingConnection(),
                config.getMaxPoolSize()
        );
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            log.info("Closing store connection pool...");
            dataSource.close();
            log.info("Store connection pool closed");
        }
    }
}
