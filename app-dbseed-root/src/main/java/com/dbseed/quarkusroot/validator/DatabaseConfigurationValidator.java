package com.dbseed.quarkusroot.validator;

import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.properties.predefined.RestoreProperties;
import com.dbseed.configuration.utils.SqlServerJdbcUrlUtils;
import com.dbseed.orchestration.model.SqlIdentifier;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

@Slf4j
@ApplicationScoped
public class DatabaseConfigurationValidator implements ConfigurationValidator {

    @Inject
    DatabaseProperties databaseProperties;

    @Inject
    RestoreProperties restoreProperties;

    @Override
    public boolean validate() {
        boolean flag = true;

        String databaseName = databaseProperties.name();
        if (!SqlIdentifier.isValid(databaseName)) {
            log.error("Invalid configuration. Database name '{}' must be 1 to 128 characters long and contain only letters, digits, '_' and '-'.", databaseName);
            flag = false;
        }

        String connectionUrl = databaseProperties.connectionUrl();
        if (!SqlServerJdbcUrlUtils.isSqlServerUrl(connectionUrl)) {
            log.error("Invalid configuration. Connection URL must start with '{}'.", SqlServerJdbcUrlUtils.URL_PREFIX);
            flag = false;
        } else {
            String urlDatabaseName = SqlServerJdbcUrlUtils.getDatabaseName(connectionUrl);
            if (urlDatabaseName != null && !urlDatabaseName.equals(databaseName)) {
                log.error("Invalid configuration. Connection URL points to database '{}', but configured database name is '{}'.", urlDatabaseName, databaseName);
                flag = false;
            }
        }

        if (StringUtils.isBlank(databaseProperties.ownerPrincipal())) {
            log.error("Invalid configuration. Owner principal must not be empty.");
            flag = false;
        }

        if (restoreProperties.dropAttempts() < 1) {
            log.error("Invalid configuration. Drop attempts count must be at least 1.");
            flag = false;
        }

        if (restoreProperties.warmUpDelay().isNegative() || restoreProperties.dropRetryDelay().isNegative()) {
            log.error("Invalid configuration. Delays must not be negative.");
            flag = false;
        }

        if (restoreProperties.restoreStatementTimeout().isNegative() || restoreProperties.restoreStatementTimeout().isZero()) {
            log.error("Invalid configuration. Restore statement timeout must be positive.");
            flag = false;
        }

        return flag;
    }
}
