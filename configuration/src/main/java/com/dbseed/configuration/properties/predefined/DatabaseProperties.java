package com.dbseed.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.util.Optional;

@ConfigMapping(prefix = "db-seed.database")
public interface DatabaseProperties {

    String name();

    String connectionUrl();

    String username();

    Optional<String> password();

    /**
     * Directory inside the database engine where local backups directory is mounted.
     */
    String engineBackupDirectory();

    /**
     * Directory inside the database engine where restored data and log files are placed.
     */
    String engineDataDirectory();

    String ownerPrincipal();
}
