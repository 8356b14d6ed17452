package com.dbseed.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "db-seed.readiness")
public interface ReadinessProperties {

    Duration pollInterval();

    Duration timeout();
}
