package com.dbseed.configuration.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqlServerJdbcUrlUtilsTest {

    @Test
    void shouldReplaceDatabaseAndKeepOtherProperties() {
        String url = "jdbc:sqlserver://db:1433;encrypt=true;databaseName=sales;trustServerCertificate=true";

        assertEquals(
                "jdbc:sqlserver://db:1433;encrypt=true;trustServerCertificate=true;databaseName=master",
                SqlServerJdbcUrlUtils.withDatabaseName(url, "master")
        );
    }

    @Test
    void shouldAddDatabaseWhenUrlHasNone() {
        assertEquals("jdbc:sqlserver://db:1433;databaseName=master", SqlServerJdbcUrlUtils.withDatabaseName("jdbc:sqlserver://db:1433", "master"));
    }

    @Test
    void shouldReadDatabaseNameRegardlessOfKeyCase() {
        assertEquals("sales", SqlServerJdbcUrlUtils.getDatabaseName("jdbc:sqlserver://db:1433;DatabaseName=sales"));
        assertEquals("sales", SqlServerJdbcUrlUtils.getDatabaseName("jdbc:sqlserver://db:1433;database=sales;encrypt=false"));
        assertNull(SqlServerJdbcUrlUtils.getDatabaseName("jdbc:sqlserver://db:1433;encrypt=false"));
    }

    @Test
    void shouldRecognizeSqlServerUrls() {
        assertTrue(SqlServerJdbcUrlUtils.isSqlServerUrl("jdbc:sqlserver://db:1433"));
        assertFalse(SqlServerJdbcUrlUtils.isSqlServerUrl("jdbc:postgresql://db:5432/sales"));
        assertFalse(SqlServerJdbcUrlUtils.isSqlServerUrl(null));
    }

    @Test
    void shouldRejectForeignUrl() {
        assertThrows(IllegalArgumentException.class, () -> SqlServerJdbcUrlUtils.withDatabaseName("jdbc:postgresql://db:5432/sales", "master"));
    }
}
