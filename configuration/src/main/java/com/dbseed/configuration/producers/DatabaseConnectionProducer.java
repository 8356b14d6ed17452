package com.dbseed.configuration.producers;

import com.dbseed.configuration.properties.constant.DbSeedConstants;
import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.utils.SqlServerJdbcUrlUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

@ApplicationScoped
public class DatabaseConnectionProducer {

    @Inject
    DatabaseProperties databaseProperties;

    /**
     * Opens connection to administrative catalog of the engine hosting provided database.
     */
    public Connection createAdministrativeConnection(String targetConnectionUrl) throws SQLException {
        return createConnection(SqlServerJdbcUrlUtils.withDatabaseName(targetConnectionUrl, DbSeedConstants.ADMINISTRATIVE_DATABASE_NAME));
    }

    /**
     * Opens connection bound to provided database, regardless of catalog named in connection URL.
     */
    public Connection createTargetConnection(String targetConnectionUrl, String databaseName) throws SQLException {
        return createConnection(SqlServerJdbcUrlUtils.withDatabaseName(targetConnectionUrl, databaseName));
    }

    public Connection createConnection(String connectionUrl) throws SQLException {
        return DriverManager.getConnection(connectionUrl, databaseProperties.username(), databaseProperties.password().orElse(""));
    }
}
