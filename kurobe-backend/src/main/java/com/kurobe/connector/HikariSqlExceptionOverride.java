package com.kurobe.connector;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTimeoutException;

/**
 * Keeps pooled relational connections alive across statement-level failures.
 *
 * <p>A query cancelled by its statement timeout (SQLSTATE 57014) or rejected as unsupported
 * (SQLSTATE class 0A) leaves the session usable, so the connection must go back to the pool
 * instead of being evicted.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    static final String QUERY_CANCELED = "57014";

    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLFeatureNotSupportedException || sqlException instanceof SQLTimeoutException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("0A") || QUERY_CANCELED.equals(sqlState)) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
