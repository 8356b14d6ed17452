package com.dbseed.configuration.properties.runtime;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ApplicationScoped
public class SeedRuntimeProperties {
    private volatile boolean engineReady = false;
    private volatile boolean databaseSeeded = false;
    private volatile String lastRunSummary;
}
