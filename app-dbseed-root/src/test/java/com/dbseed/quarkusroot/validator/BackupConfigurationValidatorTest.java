package com.dbseed.quarkusroot.validator;

import com.dbseed.configuration.properties.predefined.BackupProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackupConfigurationValidatorTest {

    @Mock
    private BackupProperties backupProperties;

    private BackupConfigurationValidator validator;

    @BeforeEach
    void setUp() {
        validator = new BackupConfigurationValidator();
        validator.backupProperties = backupProperties;

        lenient().when(backupProperties.fileUrl()).thenReturn("https://myaccount.file.core.windows.net/backups/sales.bak");
        lenient().when(backupProperties.fileName()).thenReturn("sales.bak");
        lenient().when(backupProperties.localDirectory()).thenReturn("./sqldata");
        lenient().when(backupProperties.downloadBufferSize()).thenReturn(8192);
        lenient().when(backupProperties.storageAccountKey()).thenReturn(Optional.of("ZGItc2VlZA=="));
    }

    @Test
    void shouldAcceptValidConfiguration() {
        assertTrue(validator.validate());
    }

    @Test
    void shouldAcceptMissingKey() {
        when(backupProperties.storageAccountKey()).thenReturn(Optional.empty());

        assertTrue(validator.validate());
    }

    @Test
    void shouldRejectUrlWithoutShare() {
        when(backupProperties.fileUrl()).thenReturn("https://myaccount.file.core.windows.net/sales.bak");

        assertFalse(validator.validate());
    }

    @Test
    void shouldRejectUnsupportedScheme() {
        when(backupProperties.fileUrl()).thenReturn("ftp://myaccount.file.core.windows.net/backups/sales.bak");

        assertFalse(validator.validate());
    }

    @Test
    void shouldRejectMalformedUrl() {
        when(backupProperties.fileUrl()).thenReturn("https://myaccount file/backups/sales.bak");

        assertFalse(validator.validate());
    }

    @Test
    void shouldRejectFileNameWhichCouldBreakStatements() {
        when(backupProperties.fileName()).thenReturn("sales.bak'; DROP DATABASE master; --");

        assertFalse(validator.validate());
    }
}
