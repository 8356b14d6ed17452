package com.dbseed.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;

@ConfigMapping(prefix = "db-seed.restore")
public interface RestoreProperties {

    Duration warmUpDelay();

    int dropAttempts();

    Duration dropRetryDelay();

    Duration restoreStatementTimeout();
}
