package com.dbseed.orchestration.util;

import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JdbcUtilsTest {

    @Test
    void shouldDetectDatabaseInUseError() {
        assertTrue(JdbcUtils.isDatabaseInUse(new SQLException("in use", "42000", 3702)));
    }

    @Test
    void shouldDetectDatabaseInUseErrorInChain() {
        SQLException exception = new SQLException("statement failed", "42000", 5069);
        exception.setNextException(new SQLException("in use", "42000", 3702));

        assertTrue(JdbcUtils.isDatabaseInUse(exception));
    }

    @Test
    void shouldNotTreatOtherErrorsAsDatabaseInUse() {
        assertFalse(JdbcUtils.isDatabaseInUse(new SQLException("permission denied", "42000", 262)));
    }

    @Test
    void shouldEscapeStringLiteral() {
        assertEquals("'it''s'", JdbcUtils.toStringLiteral("it's"));
    }

    @Test
    void shouldCloseConnectionWithoutThrowing() throws SQLException {
        Connection connection = mock(Connection.class);
        doThrow(new SQLException("already closed")).when(connection).close();

        JdbcUtils.closeJdbcConnectionSafely(connection);
        JdbcUtils.closeJdbcConnectionSafely(null);

        verify(connection).close();
    }
}
