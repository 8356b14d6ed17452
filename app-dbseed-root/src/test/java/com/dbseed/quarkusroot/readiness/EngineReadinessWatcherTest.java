package com.dbseed.quarkusroot.readiness;

import com.dbseed.configuration.event.DatabaseResourceReadyEvent;
import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.producers.DatabaseConnectionProducer;
import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.properties.predefined.ReadinessProperties;
import com.dbseed.configuration.properties.runtime.SeedRuntimeProperties;
import jakarta.enterprise.event.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EngineReadinessWatcherTest {

    private static final String CONNECTION_URL = "jdbc:sqlserver://db:1433;databaseName=sales";

    @Mock
    private DatabaseConnectionProducer databaseConnectionProducer;
    @Mock
    private DatabaseProperties databaseProperties;
    @Mock
    private ReadinessProperties readinessProperties;
    @Mock
    private SeedRuntimeProperties seedRuntimeProperties;
    @Mock
    private Event<DatabaseResourceReadyEvent> databaseResourceReadyEvent;
    @Mock
    private Connection connection;
    @Mock
    private Statement statement;

    private EngineReadinessWatcher watcher;

    @BeforeEach
    void setUp() {
        watcher = new EngineReadinessWatcher();
        watcher.databaseConnectionProducer = databaseConnectionProducer;
        watcher.databaseProperties = databaseProperties;
        watcher.readinessProperties = readinessProperties;
        watcher.seedRuntimeProperties = seedRuntimeProperties;
        watcher.databaseResourceReadyEvent = databaseResourceReadyEvent;

        lenient().when(databaseProperties.name()).thenReturn("sales");
        lenient().when(databaseProperties.connectionUrl()).thenReturn(CONNECTION_URL);
        lenient().when(readinessProperties.pollInterval()).thenReturn(Duration.ofMillis(1));
        lenient().when(readinessProperties.timeout()).thenReturn(Duration.ofSeconds(10));
    }

    @Test
    void shouldAnnounceDatabaseOnceEngineAcceptsConnections() throws Exception {
        when(databaseConnectionProducer.createAdministrativeConnection(CONNECTION_URL))
                .thenThrow(new SQLException("Connection refused"))
                .thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        CancellationToken cancellationToken = new CancellationToken();

        watcher.watch(cancellationToken);

        verify(databaseConnectionProducer, times(2)).createAdministrativeConnection(CONNECTION_URL);
        verify(seedRuntimeProperties).setEngineReady(true);
        ArgumentCaptor<DatabaseResourceReadyEvent> eventCaptor = ArgumentCaptor.forClass(DatabaseResourceReadyEvent.class);
        verify(databaseResourceReadyEvent).fire(eventCaptor.capture());
        assertEquals("sales", eventCaptor.getValue().getDatabaseName());
        assertEquals(CONNECTION_URL, eventCaptor.getValue().getConnectionUrlProvider().getConnectionUrl());
        assertSame(cancellationToken, eventCaptor.getValue().getCancellationToken());
    }

    @Test
    void shouldGiveUpAfterTimeout() throws SQLException {
        when(readinessProperties.timeout()).thenReturn(Duration.ZERO);
        when(databaseConnectionProducer.createAdministrativeConnection(CONNECTION_URL)).thenThrow(new SQLException("Connection refused"));

        watcher.watch(new CancellationToken());

        verify(seedRuntimeProperties, never()).setEngineReady(true);
        verify(databaseResourceReadyEvent, never()).fire(any());
    }

    @Test
    void shouldStopPollingWhenCancelled() throws SQLException {
        CancellationToken cancellationToken = new CancellationToken();
        cancellationToken.cancel();

        watcher.watch(cancellationToken);

        verify(databaseConnectionProducer, never()).createAdministrativeConnection(any());
        verify(databaseResourceReadyEvent, never()).fire(any());
    }
}
