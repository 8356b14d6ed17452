package com.dbseed.configuration.producers;

import com.dbseed.configuration.exception.ConfigurationInitializationException;
import com.dbseed.configuration.properties.predefined.BackupProperties;
import com.dbseed.configuration.properties.predefined.DatabaseProperties;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Slf4j
@ApplicationScoped
public class FilesPathsProducer {

    @Inject
    BackupProperties backupProperties;

    @Inject
    DatabaseProperties databaseProperties;

    @PostConstruct
    public void createDirs() {
        try {
            Files.createDirectories(getLocalBackupsDirectoryPath());
        } catch (IOException e) {
            log.error("Error while creating local directory for backups", e);
        }
    }

    public Path getLocalBackupsDirectoryPath() {
        return Paths.get(backupProperties.localDirectory()).toAbsolutePath().normalize();
    }

    /**
     * Local cache file is named after the last segment of the source URL.
     */
    public Path getLocalBackupFilePath() {
        return getLocalBackupsDirectoryPath().resolve(getSourceFileName());
    }

    public String getSourceFileName() {
        String path = URI.create(backupProperties.fileUrl()).getPath();
        String fileName = FilenameUtils.getName(path);

        if (StringUtils.isEmpty(fileName)) {
            throw new ConfigurationInitializationException("Backup file URL does not point to a file: " + backupProperties.fileUrl());
        }

        return fileName;
    }

    /**
     * Path of the backup file as the database engine sees it.
     */
    public String getEngineBackupFilePath() {
        return StringUtils.removeEnd(databaseProperties.engineBackupDirectory(), "/")
                + "/"
                + backupProperties.fileName();
    }

    public String getEngineDataDirectoryPath() {
        return StringUtils.removeEnd(databaseProperties.engineDataDirectory(), "/");
    }
}
