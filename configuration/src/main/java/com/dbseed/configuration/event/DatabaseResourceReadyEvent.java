package com.dbseed.configuration.event;

import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.model.ConnectionUrlProvider;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Event which is fired when database engine hosting the target database became reachable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseResourceReadyEvent {
    /**
     * Name of the database which must be seeded.
     */
    private String databaseName;
    /**
     * Accessor for target database JDBC URL. Evaluated lazily by observers.
     */
    private ConnectionUrlProvider connectionUrlProvider;
    /**
     * Cancels processing of this event.
     */
    private CancellationToken cancellationToken;
}
