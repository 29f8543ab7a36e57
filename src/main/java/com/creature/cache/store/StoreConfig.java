package com.creature.cache.store;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Configuration for {@link HikariStoreConnectionProvider} and the cache table.
 */
public class StoreConfig {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final int maxPoolSize;
    private final int minIdle;
    private final long connectionTimeoutMillis;
    private final long idleTimeoutMillis;
    private final String tableName;
    private final SqlDialect dialect;

    private StoreConfig(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.maxPoolSize = builder.maxPoolSize;
        this.minIdle = builder.minIdle;
        this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
        this.idleTimeoutMillis = builder.idleTimeoutMillis;
        this.tableName = builder.tableName;
        this.dialect = builder.dialect != null ? builder.dialect : SqlDialect.detectFromUrl(builder.jdbcUrl);
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public int getMinIdle() { return minIdle; }
    public long getConnectionTimeoutMillis() { return connectionTimeoutMillis; }
    public long getIdleTimeoutMillis() { return idleTimeoutMillis; }
    public String getTableName() { return tableName; }
    public SqlDialect getDialect() { return dialect; }

    /**
     * True for a plain or schema-qualified SQL identifier. Table names are spliced into SQL text.
     */
    public static boolean isValidTableName(String tableName) {
        return tableName != null && TABLE_NAME.matcher(tableName).matches();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String jdbcUrl;
        private String username;
        private String password;
        private int maxPoolSize = 10;
        private int minIdle = 2;
        private long connectionTimeoutMillis = 2000;
        private long idleTimeoutMillis = 30000;
        private String tableName = "pokemon";
        private SqlDialect dialect;

        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
            this.minIdle = minIdle;
            return this;
        }

        /**
         * How long {@code acquire()} waits before reporting the store unavailable.
         * Hikari rejects values under 250ms.
         */
        public Builder connectionTimeoutMillis(long connectionTimeoutMillis) {
            if (connectionTimeoutMillis < 250) {
                throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
            }
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder idleTimeoutMillis(long idleTimeoutMillis) {
            if (idleTimeoutMillis < 0) throw new IllegalArgumentException("idleTimeoutMillis must be >= 0");
            this.idleTimeoutMillis = idleTimeoutMillis;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public StoreConfig build() {
            Objects.requireNonNull(jdbcUrl, "jdbcUrl is required");
            if (minIdle > maxPoolSize) {
                throw new IllegalArgumentException("minIdle cannot exceed maxPoolSize");
            }
            if (!isValidTableName(tableName)) {
                throw new IllegalArgumentException("Invalid table name: " + tableName);
            }
            return new StoreConfig(this);
        }
    }

    @Override
    public String toString() {
        return "StoreConfig{" +
                "jdbcUrl='" + jdbcUrl + '\'' +
                ", username='" + username + '\'' +
                ", maxPoolSize=" + maxPoolSize +
                ", minIdle=" + minIdle +
                ", connectionTimeoutMillis=" + connectionTimeoutMillis +
                ", tableName='" + tableName + '\'' +
                ", dialect=" + dialect +
                '}';
    }
}
