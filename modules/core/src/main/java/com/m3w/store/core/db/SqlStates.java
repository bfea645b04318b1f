package com.m3w.store.core.db;

import java.sql.SQLException;

/**
 * SQLSTATE classification shared by PostgreSQL and H2.
 */
public final class SqlStates {

    public static final String UNIQUE_VIOLATION = "23505";

    private SqlStates() {
    }

    /**
     * True if any {@link SQLException} in the cause chain reports a unique violation.
     */
    public static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
