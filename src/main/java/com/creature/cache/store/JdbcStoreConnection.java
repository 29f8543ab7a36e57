package com.creature.cache.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Clob;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of {@link StoreConnection}.
 *
 * <p>JSON, JSONB and CLOB columns are read as text so that callers see either a
 * driver-native structured value or a string, never a driver-specific wrapper.</p>
 */
public class JdbcStoreConnection implements StoreConnection {
    private static final Logger log = LoggerFactory.getLogger(JdbcStoreConnection.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final Connection connection;

    public JdbcStoreConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<Map<String, Object>> queryOne(String sql, List<Object> params) {
        log.debug("Querying: {}", sql);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRow(resultSet));
            }
        } catch (SQLException e) {
            throw new StoreException("Query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int execute(String sql, List<Object> params) {
        log.debug("Executing: {}", sql);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, params);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Statement failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isValid() {
        try {
            return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            log.warn("Connection validation failed", e);
            return false;
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error releasing store connection: {}", e.getMessage());
        }
    }

    private void bind(PreparedStatement statement, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            statement.setObject(i + 1, params.get(i));
        }
    }

    private Map<String, Object> readRow(ResultSet resultSet) throws SQLException {
        ResultSetMetaData metaData = resultSet.getMetaData();
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            String label = metaData.getColumnLabel(i).toLowerCase(Locale.ROOT);
            row.put(label, readValue(resultSet, metaData, i));
        }
        return row;
    }

    private Object readValue(ResultSet resultSet, ResultSetMetaData metaData, int column) throws SQLException {
        String typeName = metaData.getColumnTypeName(column);
        if (typeName != null) {
            String lowerType = typeName.toLowerCase(Locale.ROOT);
            if (lowerType.equals("json") || lowerType.equals("jsonb")) {
                return resultSet.getString(column);
            }
        }
        Object value = resultSet.getObject(column);
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        return value;
    }
}
