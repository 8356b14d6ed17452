package com.dbseed.configuration.utils;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Helpers for SQL Server JDBC URLs of form {@code jdbc:sqlserver://host:port;key=value;...}.
 * Values containing ';' inside braces are not supported.
 */
public class SqlServerJdbcUrlUtils {

    public static final String URL_PREFIX = "jdbc:sqlserver://";

    private static final Set<String> DATABASE_PROPERTY_NAMES = Set.of("databasename", "database");

    public static boolean isSqlServerUrl(String url) {
        return StringUtils.startsWithIgnoreCase(url, URL_PREFIX);
    }

    /**
     * @return database named in the URL or null if URL has no database property
     */
    public static String getDatabaseName(String url) {
        String[] parts = StringUtils.split(url, ';');
        for (int i = 1; i < parts.length; i++) {
            String key = StringUtils.substringBefore(parts[i], "=").trim();
            if (DATABASE_PROPERTY_NAMES.contains(key.toLowerCase())) {
                return StringUtils.substringAfter(parts[i], "=").trim();
            }
        }
        return null;
    }

    /**
     * Returns same URL pointing to another database, all other properties are preserved.
     */
    public static String withDatabaseName(String url, String databaseName) {
        if (!isSqlServerUrl(url)) {
            throw new IllegalArgumentException("Not a SQL Server JDBC URL");
        }

        String[] parts = StringUtils.split(url, ';');
        List<String> resultParts = new ArrayList<>();
        resultParts.add(parts[0]);

        for (int i = 1; i < parts.length; i++) {
            String key = StringUtils.substringBefore(parts[i], "=").trim();
            if (!DATABASE_PROPERTY_NAMES.contains(key.toLowerCase())) {
                resultParts.add(parts[i]);
            }
        }
        resultParts.add("databaseName=" + databaseName);

        return String.join(";", resultParts);
    }

    private SqlServerJdbcUrlUtils() {
    }
}
