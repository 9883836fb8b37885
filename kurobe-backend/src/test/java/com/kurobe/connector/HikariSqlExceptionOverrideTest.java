package com.kurobe.connector;

import com.zaxxer.hikari.SQLExceptionOverride.Override;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class HikariSqlExceptionOverrideTest {

    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void statementLevelFailuresKeepTheConnection() {
        assertThat(override.adjudicate(new SQLException("canceling statement due to statement timeout", "57014")))
                .isEqualTo(Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLTimeoutException("timeout"))).isEqualTo(Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLFeatureNotSupportedException("nope"))).isEqualTo(Override.DO_NOT_EVICT);
        assertThat(override.adjudicate(new SQLException("unsupported", "0A000"))).isEqualTo(Override.DO_NOT_EVICT);
    }

    @Test
    void connectionFailuresEvict() {
        assertThat(override.adjudicate(new SQLException("connection reset", "08006"))).isEqualTo(Override.CONTINUE_EVICT);
        assertThat(override.adjudicate(new SQLException("no state"))).isEqualTo(Override.CONTINUE_EVICT);
        assertThat(override.adjudicate(null)).isEqualTo(Override.CONTINUE_EVICT);
    }
}
