package com.dbseed.quarkusroot.readiness;

import com.dbseed.configuration.event.DatabaseSeedCompletedEvent;
import com.dbseed.configuration.properties.runtime.SeedRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Publishes outcome of seed run to readiness state.
 */
@Slf4j
@ApplicationScoped
public class DatabaseSeedCompletionListener {

    @Inject
    SeedRuntimeProperties seedRuntimeProperties;

    public void onDatabaseSeedCompleted(@Observes DatabaseSeedCompletedEvent event) {
        seedRuntimeProperties.setDatabaseSeeded(event.isSuccess());
        seedRuntimeProperties.setLastRunSummary(event.getSummary());

        if (event.isSuccess()) {
            log.info("Database {} is seeded. {}", event.getDatabaseName(), event.getSummary());
        } else {
            log.error("Database {} was not seeded. {}", event.getDatabaseName(), event.getSummary());
        }
    }
}
