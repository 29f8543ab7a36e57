package com.creature.cache.store;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SQL dialects the cache writes to. Each knows how to phrase an insert that
 * leaves an existing row with the same key untouched.
 */
public enum SqlDialect {
    GENERIC,
    POSTGRESQL,
    MYSQL,
    SQLITE,
    H2;

    /**
     * Builds an insert that is a no-op when a row with the same {@code keyColumn} exists.
     * Values for {@code jsonColumns} are bound as JSON text and converted by the database,
     * so they land in JSON/JSONB columns as documents and in text columns as their text.
     * H2 and generic databases get a plain insert; the duplicate surfaces as a
     * unique violation that callers treat the same way as a skipped insert.
     */
    public String insertIgnoring(String table, String keyColumn, List<String> columns, Set<String> jsonColumns) {
        String columnList = String.join(", ", columns);
        String placeholders = columns.stream()
                .map(column -> jsonColumns.contains(column) ? jsonParameter() : "?")
                .collect(Collectors.joining(", "));

        return switch (this) {
            case POSTGRESQL -> "INSERT INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")"
                    + " ON CONFLICT (" + keyColumn + ") DO NOTHING";
            case MYSQL -> "INSERT IGNORE INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")";
            case SQLITE -> "INSERT OR IGNORE INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")";
            default -> "INSERT INTO " + table + " (" + columnList + ") VALUES (" + placeholders + ")";
        };
    }

    /**
     * Placeholder for a parameter bound as JSON text. PostgreSQL will not assign a varchar
     * parameter to a jsonb column, and H2 would store it as a JSON string rather than parse it.
     */
    public String jsonParameter() {
        return switch (this) {
            case POSTGRESQL -> "CAST(? AS jsonb)";
            case H2 -> "? FORMAT JSON";
            default -> "?";
        };
    }

    /**
     * Detects the dialect from a JDBC URL.
     */
    public static SqlDialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.startsWith("jdbc:postgresql:")) return POSTGRESQL;
        if (lowerUrl.startsWith("jdbc:mysql:") || lowerUrl.startsWith("jdbc:mariadb:")) return MYSQL;
        if (lowerUrl.startsWith("jdbc:sqlite:")) return SQLITE;
        if (lowerUrl.startsWith("jdbc:h2:")) return H2;

        return GENERIC;
    }
}
