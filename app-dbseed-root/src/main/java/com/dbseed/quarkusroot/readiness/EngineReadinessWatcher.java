package com.dbseed.quarkusroot.readiness;

import com.dbseed.configuration.event.DatabaseResourceReadyEvent;
import com.dbseed.configuration.exception.OperationCancelledException;
import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.producers.DatabaseConnectionProducer;
import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.properties.predefined.ReadinessProperties;
import com.dbseed.configuration.properties.runtime.SeedRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Waits for the database engine to accept connections and then announces the database resource as ready.
 */
@Slf4j
@ApplicationScoped
public class EngineReadinessWatcher {

    private static final String HEALTHCHECK_QUERY = "SELECT 1";

    @Inject
    DatabaseConnectionProducer databaseConnectionProducer;

    @Inject
    DatabaseProperties databaseProperties;

    @Inject
    ReadinessProperties readinessProperties;

    @Inject
    SeedRuntimeProperties seedRuntimeProperties;

    @Inject
    Event<DatabaseResourceReadyEvent> databaseResourceReadyEvent;

    public void watch(CancellationToken cancellationToken) {
        try {
            if (!waitUntilEngineReady(cancellationToken)) {
                log.error("Database engine did not become ready in {}. Database {} will not be seeded.", readinessProperties.timeout(), databaseProperties.name());
                return;
            }
        } catch (OperationCancelledException e) {
            log.info("Stopped waiting for database engine: cancelled.");
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting for database engine.", e);
            return;
        }

        seedRuntimeProperties.setEngineReady(true);
        log.info("Database engine is ready, notifying about database resource {}.", databaseProperties.name());

        databaseResourceReadyEvent.fire(
                DatabaseResourceReadyEvent
                        .builder()
                        .databaseName(databaseProperties.name())
                        .connectionUrlProvider(databaseProperties::connectionUrl)
                        .cancellationToken(cancellationToken)
                        .build()
        );
    }

    public boolean waitUntilEngineReady(CancellationToken cancellationToken) throws InterruptedException {
        long endTime = System.currentTimeMillis() + readinessProperties.timeout().toMillis();

        while (true) {
            cancellationToken.throwIfCancellationRequested();

            if (checkEngineLiveliness()) {
                return true;
            }

            if (System.currentTimeMillis() >= endTime) {
                return false;
            }

            cancellationToken.sleep(readinessProperties.pollInterval());
        }
    }

    boolean checkEngineLiveliness() {
        try (Connection connection = databaseConnectionProducer.createAdministrativeConnection(databaseProperties.connectionUrl());
             Statement statement = connection.createStatement()) {
            statement.execute(HEALTHCHECK_QUERY);
            return true;
        } catch (SQLException e) {
            log.debug("Database engine is not ready yet: {}", e.getMessage());
            return false;
        }
    }
}
