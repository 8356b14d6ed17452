package com.dbseed.orchestration.service.impl;

import com.dbseed.configuration.event.DatabaseResourceReadyEvent;
import com.dbseed.configuration.event.DatabaseSeedCompletedEvent;
import com.dbseed.configuration.exception.OperationCancelledException;
import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.model.ConnectionUrlProvider;
import com.dbseed.configuration.producers.DatabaseConnectionProducer;
import com.dbseed.configuration.producers.FilesPathsProducer;
import com.dbseed.configuration.properties.constant.DbSeedConstants;
import com.dbseed.configuration.properties.predefined.BackupProperties;
import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.properties.predefined.RestoreProperties;
import com.dbseed.orchestration.adapter.api.BackupStorageAdapter;
import com.dbseed.orchestration.constant.SqlServerConstants;
import com.dbseed.orchestration.exception.ConnectionStringUnavailableException;
import com.dbseed.orchestration.exception.DownloadException;
import com.dbseed.orchestration.exception.InvalidIdentifierException;
import com.dbseed.orchestration.exception.LockContentionException;
import com.dbseed.orchestration.exception.RestoreStatementException;
import com.dbseed.orchestration.model.BackupManifestEntry;
import com.dbseed.orchestration.model.BackupSource;
import com.dbseed.orchestration.model.DatabaseClassification;
import com.dbseed.orchestration.model.LocalCacheEntry;
import com.dbseed.orchestration.model.RestoreOutcome;
import com.dbseed.orchestration.model.RestoreResult;
import com.dbseed.orchestration.model.RestoreRun;
import com.dbseed.orchestration.model.RestoreState;
import com.dbseed.orchestration.model.RestoreTarget;
import com.dbseed.orchestration.model.SqlIdentifier;
import com.dbseed.orchestration.service.api.DatabaseProbe;
import com.dbseed.orchestration.service.api.DatabaseRestoreOrchestrator;
import com.dbseed.orchestration.util.JdbcUtils;
import com.dbseed.orchestration.util.SqlServerStatementUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@ApplicationScoped
public class DatabaseRestoreOrchestratorImpl implements DatabaseRestoreOrchestrator {

    @Inject
    BackupStorageAdapter backupStorageAdapter;

    @Inject
    DatabaseProbe databaseProbe;

    @Inject
    DatabaseConnectionProducer databaseConnectionProducer;

    @Inject
    FilesPathsProducer filesPathsProducer;

    @Inject
    BackupProperties backupProperties;

    @Inject
    DatabaseProperties databaseProperties;

    @Inject
    RestoreProperties restoreProperties;

    @Inject
    Event<DatabaseSeedCompletedEvent> databaseSeedCompletedEvent;

    Sleeper sleeper = (duration, cancellationToken) -> cancellationToken.sleep(duration);

    private final AtomicBoolean restoreInProgress = new AtomicBoolean(false);

    public void onDatabaseResourceReady(@Observes DatabaseResourceReadyEvent event) {
        CancellationToken cancellationToken = event.getCancellationToken() != null ? event.getCancellationToken() : CancellationToken.none();

        if (!restoreInProgress.compareAndSet(false, true)) {
            log.warn("Restore of database {} is already in progress, ignoring ready event.", event.getDatabaseName());
            return;
        }

        try {
            RestoreResult result = restore(event.getDatabaseName(), event.getConnectionUrlProvider(), cancellationToken);

            databaseSeedCompletedEvent.fire(new DatabaseSeedCompletedEvent(event.getDatabaseName(), result.isSuccess(), result.getSummary()));
        } finally {
            restoreInProgress.set(false);
        }
    }

    @Override
    public RestoreResult restore(String databaseName, ConnectionUrlProvider connectionUrlProvider, CancellationToken cancellationToken) {
        MDC.put(DbSeedConstants.MDC_DATABASE_KEY, databaseName);
        try {
            SqlIdentifier identifier;
            try {
                identifier = SqlIdentifier.of(databaseName);
            } catch (InvalidIdentifierException e) {
                log.error("Refusing to restore database with invalid name.", e);
                return failBeforeStart(null, e);
            }

            String connectionUrl;
            try {
                connectionUrl = connectionUrlProvider.getConnectionUrl();
            } catch (Exception e) {
                log.error("Could not get connection string for database {}", databaseName, e);
                return failBeforeStart(identifier, new ConnectionStringUnavailableException("Connection string for database " + databaseName + " is unavailable.", e));
            }

            if (StringUtils.isEmpty(connectionUrl)) {
                log.error("Could not get connection string for database {}", databaseName);
                return failBeforeStart(identifier, new ConnectionStringUnavailableException("Connection string for database " + databaseName + " is unavailable."));
            }

            return restore(RestoreTarget.builder().databaseName(identifier).connectionUrl(connectionUrl).build(), cancellationToken);
        } finally {
            MDC.remove(DbSeedConstants.MDC_DATABASE_KEY);
        }
    }

    @Override
    public RestoreResult restore(RestoreTarget target, CancellationToken cancellationToken) {
        RestoreRun run = new RestoreRun(target.getDatabaseName());
        RestoreOutcome outcome;

        try {
            log.info("Starting database restore for {}...", target.getDatabaseName());
            outcome = runRestoreSequence(target, run, cancellationToken);
        } catch (OperationCancelledException e) {
            log.warn("Restore of database {} was cancelled in state {}.", target.getDatabaseName(), run.getState());
            return run.finish(RestoreOutcome.FAILED, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Restore of database {} was interrupted in state {}.", target.getDatabaseName(), run.getState(), e);
            return run.finish(RestoreOutcome.FAILED, e);
        } catch (Exception e) {
            log.error("Error restoring database {} in state {}", target.getDatabaseName(), run.getState(), e);
            return run.finish(RestoreOutcome.FAILED, e);
        }

        return run.finish(outcome, null);
    }

    private RestoreOutcome runRestoreSequence(RestoreTarget target, RestoreRun run, CancellationToken cancellationToken) throws InterruptedException {
        run.transitionTo(RestoreState.FETCHING);
        fetchBackup(cancellationToken);

        sleeper.sleep(restoreProperties.warmUpDelay(), cancellationToken);

        Connection administrativeConnection = null;
        try {
            administrativeConnection = databaseConnectionProducer.createAdministrativeConnection(target.getConnectionUrl());
            log.info("Connected to SQL Server, checking if database {} exists...", target.getDatabaseName());

            run.transitionTo(RestoreState.PROBING);
            DatabaseClassification classification = databaseProbe.classify(administrativeConnection, target, new DatabaseProbe.ProbeListener() {
                @Override
                public void onReclaimStarted() {
                    run.transitionTo(RestoreState.RECLAIMING);
                }

                @Override
                public void onReclaimFinished(boolean succeeded) {
                    run.transitionTo(RestoreState.PROBING);
                }
            });
            cancellationToken.throwIfCancellationRequested();

            switch (classification.getState()) {
                case PRESENT_POPULATED -> {
                    log.info("Database {} already has {} tables, skipping restore.", target.getDatabaseName(), classification.getTableCount());
                    return RestoreOutcome.SKIPPED_ALREADY_POPULATED;
                }
                case PRESENT_EMPTY -> {
                    log.info("Database {} exists but is empty, will restore from backup.", target.getDatabaseName());
                    run.transitionTo(RestoreState.DROPPING);
                    dropWithRetry(administrativeConnection, target, run, cancellationToken);
                }
                default -> log.info("Database {} does not exist, will restore from backup.", target.getDatabaseName());
            }

            run.transitionTo(RestoreState.RESTORING);
            restoreFromBackup(administrativeConnection, target, cancellationToken);

            run.transitionTo(RestoreState.FINALIZING);
            finalizeRestoredDatabase(administrativeConnection, target, run);
        } catch (SQLException e) {
            throw new RestoreStatementException("Database statement failed in state " + run.getState(), e);
        } finally {
            JdbcUtils.closeJdbcConnectionSafely(administrativeConnection);
        }

        if (CollectionUtils.isEmpty(run.getWarnings())) {
            log.info("Database {} fully initialized!", target.getDatabaseName());
            return RestoreOutcome.RESTORED;
        }

        log.warn("Database {} restored, but finalization finished with warnings: {}", target.getDatabaseName(), run.getWarnings());
        return RestoreOutcome.RESTORED_WITH_WARNINGS;
    }

    private void fetchBackup(CancellationToken cancellationToken) {
        BackupSource source;
        try {
            source = BackupSource.fromUrl(backupProperties.fileUrl(), backupProperties.storageAccountKey().orElse(null));
        } catch (IllegalArgumentException e) {
            throw new DownloadException("Invalid backup source URL.", e);
        }

        LocalCacheEntry cacheEntry = backupStorageAdapter.ensureLocal(
                source,
                filesPathsProducer.getLocalBackupFilePath(),
                progress -> log.info(
                        "Download progress: {}% ({} MB / {} MB)",
                        progress.getPercentage(),
                        String.format("%.2f", progress.getBytesTransferred() / (1024.0 * 1024.0)),
                        String.format("%.2f", progress.getTotalBytes() / (1024.0 * 1024.0))
                ),
                cancellationToken
        );

        if (!cacheEntry.isExists()) {
            throw new DownloadException("Backup " + cacheEntry.getLocalPath() + " is not available locally. Restore is not possible.");
        }
    }

    private void dropWithRetry(Connection administrativeConnection, RestoreTarget target, RestoreRun run, CancellationToken cancellationToken) throws InterruptedException {
        int maxAttempts = restoreProperties.dropAttempts();

        for (int attempt = 1; ; attempt++) {
            cancellationToken.throwIfCancellationRequested();
            run.incrementDropAttempts();

            try (Statement statement = administrativeConnection.createStatement()) {
                statement.execute(SqlServerStatementUtils.createSingleUserAndDropStatement(target.getDatabaseName()));
                log.info("Dropped empty database {}", target.getDatabaseName());
                return;
            } catch (SQLException e) {
                if (!JdbcUtils.isDatabaseInUse(e)) {
                    throw new RestoreStatementException("Failed to drop database " + target.getDatabaseName(), e);
                }

                if (attempt >= maxAttempts) {
                    throw new LockContentionException("Database " + target.getDatabaseName() + " is still in use after " + attempt + " drop attempts.", e);
                }

                log.warn("Database in use, waiting before retry {}/{}", attempt, maxAttempts);
                sleeper.sleep(restoreProperties.dropRetryDelay(), cancellationToken);
            }
        }
    }

    private void restoreFromBackup(Connection administrativeConnection, RestoreTarget target, CancellationToken cancellationToken) throws SQLException {
        log.info("Restoring database {} from backup...", target.getDatabaseName());
        String engineBackupFilePath = filesPathsProducer.getEngineBackupFilePath();

        List<BackupManifestEntry> manifest = readManifest(administrativeConnection, engineBackupFilePath);
        log.info("Found {} files in backup", manifest.size());

        if (manifest.isEmpty()) {
            throw new RestoreStatementException("Backup " + engineBackupFilePath + " contains no files.");
        }

        cancellationToken.throwIfCancellationRequested();

        String restoreStatement = SqlServerStatementUtils.createRestoreStatement(
                target.getDatabaseName(),
                engineBackupFilePath,
                filesPathsProducer.getEngineDataDirectoryPath(),
                manifest
        );

        log.info("Executing RESTORE command...");
        try (Statement statement = administrativeConnection.createStatement()) {
            statement.setQueryTimeout(toTimeoutSeconds(restoreProperties.restoreStatementTimeout()));
            statement.execute(restoreStatement);
        }

        log.info("Database {} restored successfully!", target.getDatabaseName());
    }

    private List<BackupManifestEntry> readManifest(Connection administrativeConnection, String engineBackupFilePath) throws SQLException {
        List<BackupManifestEntry> manifest = new ArrayList<>();

        try (Statement statement = administrativeConnection.createStatement();
             ResultSet resultSet = statement.executeQuery(SqlServerStatementUtils.createFileListQuery(engineBackupFilePath))) {
            while (resultSet.next()) {
                String type = resultSet.getString(SqlServerConstants.FILE_LIST_TYPE_COLUMN);
                manifest.add(new BackupManifestEntry(
                        resultSet.getString(SqlServerConstants.FILE_LIST_LOGICAL_NAME_COLUMN),
                        SqlServerConstants.FILE_LIST_TYPE_LOG.equals(type) ? BackupManifestEntry.StreamKind.LOG : BackupManifestEntry.StreamKind.DATA
                ));
            }
        }

        return manifest;
    }

    private void finalizeRestoredDatabase(Connection administrativeConnection, RestoreTarget target, RestoreRun run) {
        log.info("Setting TRUSTWORTHY ON for database {}...", target.getDatabaseName());
        try (Statement statement = administrativeConnection.createStatement()) {
            statement.execute(SqlServerStatementUtils.createSetTrustworthyStatement(target.getDatabaseName()));
        } catch (SQLException e) {
            log.warn("Failed to set TRUSTWORTHY ON for database {}", target.getDatabaseName(), e);
            run.addWarning("TRUSTWORTHY flag not set: " + e.getMessage());
        }

        String ownerPrincipal = databaseProperties.ownerPrincipal();
        Connection targetConnection = null;
        try {
            targetConnection = databaseConnectionProducer.createTargetConnection(target.getConnectionUrl(), target.getDatabaseName().getValue());
            try (Statement statement = targetConnection.createStatement()) {
                statement.execute(SqlServerStatementUtils.createChangeOwnerStatement(ownerPrincipal));
            }
            log.info("Changed owner of database {} to {}", target.getDatabaseName(), ownerPrincipal);
        } catch (SQLException e) {
            log.warn("Failed to change owner of database {} to {}", target.getDatabaseName(), ownerPrincipal, e);
            run.addWarning("Owner not changed to " + ownerPrincipal + ": " + e.getMessage());
        } finally {
            JdbcUtils.closeJdbcConnectionSafely(targetConnection);
        }
    }

    private RestoreResult failBeforeStart(SqlIdentifier databaseName, RuntimeException cause) {
        return new RestoreRun(databaseName).finish(RestoreOutcome.FAILED, cause);
    }

    private static int toTimeoutSeconds(Duration duration) {
        return (int) Math.max(1, duration.toSeconds());
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration, CancellationToken cancellationToken) throws InterruptedException;
    }
}
