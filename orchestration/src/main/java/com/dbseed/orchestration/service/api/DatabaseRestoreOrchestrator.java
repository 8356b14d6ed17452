package com.dbseed.orchestration.service.api;

import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.model.ConnectionUrlProvider;
import com.dbseed.orchestration.model.RestoreResult;
import com.dbseed.orchestration.model.RestoreTarget;

/**
 * Seeds target database from backup exactly once. Populated databases are never overwritten.
 * <p>
 * Methods of this interface never throw: any failure is logged and reported as {@link RestoreResult} in FAILED state.
 * Next run will probe the database again and continue from whatever state it was left in.
 */
public interface DatabaseRestoreOrchestrator {

    /**
     * Resolves connection URL and runs {@link #restore(RestoreTarget, CancellationToken)}.
     *
     * @param databaseName          name of the target database, validated before use
     * @param connectionUrlProvider accessor for target JDBC URL
     * @param cancellationToken     cancels the run
     * @return result of the run
     */
    RestoreResult restore(String databaseName, ConnectionUrlProvider connectionUrlProvider, CancellationToken cancellationToken);

    /**
     * Fetches backup if needed, probes target database and restores it when it is absent or empty.
     *
     * @param target            database to seed
     * @param cancellationToken cancels the run
     * @return result of the run
     */
    RestoreResult restore(RestoreTarget target, CancellationToken cancellationToken);
}
