package com.dbseed.configuration.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event which is fired when seeding of a database finished, successfully or not.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseSeedCompletedEvent {
    private String databaseName;
    /**
     * Indicates if database ended up in usable state
     */
    private boolean success;
    private String summary;
}
