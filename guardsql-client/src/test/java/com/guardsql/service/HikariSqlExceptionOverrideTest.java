package com.guardsql.service;

import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HikariSqlExceptionOverrideTest {
    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void keepsConnectionForInteractiveErrors() {
        for (String state : new String[] {"57014", "25006", "25P02", "0A000"}) {
            assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                    override.adjudicate(new SQLException("x", state)), state);
        }
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLFeatureNotSupportedException("no")));
    }

    @Test
    void evictsOnOtherErrors() {
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("gone", "08006")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT,
                override.adjudicate(new SQLException("busy", null, 5)));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(null));
    }
}
