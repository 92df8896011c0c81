package com.guardsql.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.Set;

/**
 * HikariCP SQL exception override that keeps connections alive through errors that are part of
 * normal interactive use: cancelled queries, writes rejected by a read-only session, aborted
 * transactions and unsupported features.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    private static final Set<String> KEEP_STATES = Set.of(
            "57014", // query_canceled
            "25006", // read_only_sql_transaction
            "25P02"  // in_failed_sql_transaction
    );

    /** SQLite result codes: SQLITE_READONLY, SQLITE_INTERRUPT, SQLITE_BUSY. */
    private static final Set<Integer> KEEP_SQLITE_CODES = Set.of(8, 9, 5);

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || KEEP_STATES.contains(sqlState))) {
            return Override.DO_NOT_EVICT;
        }

        if (sqlException.getClass().getName().startsWith("org.sqlite.")
                && KEEP_SQLITE_CODES.contains(sqlException.getErrorCode())) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
