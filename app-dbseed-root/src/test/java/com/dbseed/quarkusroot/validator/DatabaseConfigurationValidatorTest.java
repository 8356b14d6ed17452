package com.dbseed.quarkusroot.validator;

import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import com.dbseed.configuration.properties.predefined.RestoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseConfigurationValidatorTest {

    @Mock
    private DatabaseProperties databaseProperties;

    @Mock
    private RestoreProperties restoreProperties;

    private DatabaseConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new DatabaseConfigurationValidator();
        validator.databaseProperties = databaseProperties;
        validator.restoreProperties = restoreProperties;

        lenient().when(databaseProperties.name()).thenReturn("sales");
        lenient().when(databaseProperties.connectionUrl()).thenReturn("jdbc:sqlserver://db:1433;databaseName=sales;encrypt=false");
        lenient().when(databaseProperties.ownerPrincipal()).thenReturn("sa");
        lenient().when(restoreProperties.dropAttempts()).thenReturn(3);
        lenient().when(restoreProperties.warmUpDelay()).thenReturn(Duration.ofSeconds(5));
        lenient().when(restoreProperties.dropRetryDelay()).thenReturn(Duration.ofSeconds(2));
        lenient().when(restoreProperties.restoreStatementTimeout()).thenReturn(Duration.ofMinutes(5));
    }

    @Test
    void shouldAcceptValidConfiguration() {
        assertTrue(validator.validate());
    }

    @Test
    void shouldRejectUnsafeDatabaseName() {
        when(databaseProperties.name()).thenReturn("sales]; DROP DATABASE master");

        assertFalse(validator.validate());
    }

    @Test
    void shouldApplyIdentifierLengthLimitToDatabaseName() {
        when(databaseProperties.connectionUrl()).thenReturn("jdbc:sqlserver://db:1433");

        when(databaseProperties.name()).thenReturn("a".repeat(129));
        assertFalse(validator.validate());

        when(databaseProperties.name()).thenReturn("a".repeat(128));
        assertTrue(validator.validate());
    }

    @Test
    void shouldRejectNonSqlServerUrl() {
        when(databaseProperties.connectionUrl()).thenReturn("jdbc:postgresql://db:5432/sales");

        assertFalse(validator.validate());
    }

    @Test
    void shouldRejectUrlPointingToAnotherDatabase() {
        when(databaseProperties.connectionUrl()).thenReturn("jdbc:sqlserver://db:1433;databaseName=inventory");

        assertFalse(validator.validate());
    }

    @Test
    void shouldRejectZeroDropAttempts() {
        when(restoreProperties.dropAttempts()).thenReturn(0);

        assertFalse(validator.validate());
    }
}
