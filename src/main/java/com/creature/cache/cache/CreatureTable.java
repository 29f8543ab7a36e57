package com.creature.cache.cache;

import com.creature.cache.store.SqlDialect;
import com.creature.cache.store.StoreConfig;

import java.util.List;
import java.util.Set;

/**
 * Column layout of the cache table and the statements run against it.
 * The table itself is created and migrated outside this library.
 */
public final class CreatureTable {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String STATS = "stats";
    public static final String TOTAL_BASE_STATS = "total_base_stats";
    public static final String TYPES = "types";
    public static final String IMAGE = "image";
    public static final String SHINY_IMAGE = "shiny_image";

    private static final List<String> COLUMNS = List.of(ID, NAME, STATS, TOTAL_BASE_STATS, TYPES, IMAGE, SHINY_IMAGE);
    private static final Set<String> JSON_COLUMNS = Set.of(STATS, TYPES);

    private final String tableName;
    private final String selectById;
    private final String insertIgnoring;

    public CreatureTable(String tableName, SqlDialect dialect) {
        if (!StoreConfig.isValidTableName(tableName)) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        this.tableName = tableName;
        this.selectById = "SELECT " + String.join(", ", COLUMNS) + " FROM " + tableName + " WHERE " + ID + " = ?";
        this.insertIgnoring = dialect.insertIgnoring(tableName, ID, COLUMNS, JSON_COLUMNS);
    }

    public String getTableName() {
        return tableName;
    }

    String selectById() {
        return selectById;
    }

    String insertIgnoring() {
        return insertIgnoring;
    }
}
