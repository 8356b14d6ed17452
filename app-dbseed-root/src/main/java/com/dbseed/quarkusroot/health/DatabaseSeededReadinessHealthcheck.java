package com.dbseed.quarkusroot.health;

import com.dbseed.configuration.properties.constant.DbSeedConstants;
import com.dbseed.configuration.properties.runtime.SeedRuntimeProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class DatabaseSeededReadinessHealthcheck implements HealthCheck {

    @Inject
    SeedRuntimeProperties seedRuntimeProperties;

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder responseBuilder = HealthCheckResponse.named(DbSeedConstants.DATABASE_SEEDED_READINESS_CHECK)
                .withData("engineReady", seedRuntimeProperties.isEngineReady());

        if (seedRuntimeProperties.getLastRunSummary() != null) {
            responseBuilder.withData("lastRun", seedRuntimeProperties.getLastRunSummary());
        }

        if (seedRuntimeProperties.isDatabaseSeeded()) {
            responseBuilder.up();
        } else {
            responseBuilder.down();
        }

        return responseBuilder.build();
    }
}
