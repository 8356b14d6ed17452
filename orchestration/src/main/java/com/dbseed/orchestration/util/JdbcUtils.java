package com.dbseed.orchestration.util;

import com.dbseed.orchestration.constant.SqlServerConstants;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

@Slf4j
public class JdbcUtils {
    public static void closeJdbcConnectionSafely(Connection connection) {
        if (connection == null) {
            return;
        }

        try {
            connection.close();
        } catch (Exception e) {
            log.debug("Failed to close JDBC connection.", e);
        }
    }

    /**
     * Checks whole exception chain, driver may attach the engine error as next exception.
     */
    public static boolean isDatabaseInUse(SQLException exception) {
        SQLException current = exception;
        while (current != null) {
            if (current.getErrorCode() == SqlServerConstants.DATABASE_IN_USE_ERROR_NUMBER) {
                return true;
            }
            current = current.getNextException();
        }
        return false;
    }

    /**
     * Escapes value to be used inside single-quoted string literal.
     */
    public static String toStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private JdbcUtils() {
    }
}
