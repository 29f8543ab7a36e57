package com.creature.cache.store;

import java.sql.SQLException;

/**
 * Unchecked wrapper for a failed store operation.
 * Keeps the SQLState and vendor code of the underlying {@link SQLException} when there is one.
 */
public class StoreException extends RuntimeException {

    private static final String UNIQUE_VIOLATION = "23505";
    // MySQL ER_DUP_ENTRY, reported with the generic 23000 state
    private static final int MYSQL_DUPLICATE_ENTRY = 1062;

    private final String sqlState;
    private final int vendorCode;

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        if (cause instanceof SQLException sql) {
            this.sqlState = sql.getSQLState();
            this.vendorCode = sql.getErrorCode();
        } else {
            this.sqlState = null;
            this.vendorCode = 0;
        }
    }

    public StoreException(String message) {
        super(message);
        this.sqlState = null;
        this.vendorCode = 0;
    }

    /**
     * SQLState reported by the driver, or null.
     */
    public String getSqlState() {
        return sqlState;
    }

    public int getVendorCode() {
        return vendorCode;
    }

    /**
     * Whether the failure is a primary key or unique constraint violation.
     */
    public boolean isUniqueViolation() {
        return UNIQUE_VIOLATION.equals(sqlState) || vendorCode == MYSQL_DUPLICATE_ENTRY;
    }
}
