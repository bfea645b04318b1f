package com.m3w.store.mirror;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

final class MirrorSqlErrors {

    private MirrorSqlErrors() {
    }

    /**
     * True if any {@link SQLiteException} in the cause chain is a unique or
     * primary key violation.
     */
    static boolean isUniqueViolation(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLiteException sqlite) {
                SQLiteErrorCode code = sqlite.getResultCode();
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                        || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                    return true;
                }
                if (code == SQLiteErrorCode.SQLITE_CONSTRAINT && sqlite.getMessage() != null
                        && sqlite.getMessage().contains("UNIQUE")) {
                    return true;
                }
            }
        }
        return false;
    }
}
