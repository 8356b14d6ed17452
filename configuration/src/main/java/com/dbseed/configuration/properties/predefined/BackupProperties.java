package com.dbseed.configuration.properties.predefined;

import io.smallrye.config.ConfigMapping;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "db-seed.backup")
public interface BackupProperties {

    /**
     * Full URL of the backup file on the file share, e.g. https://account.file.core.windows.net/share/dir/backup.bak
     */
    String fileUrl();

    /**
     * Base64 encoded storage account key. Only required when the backup is not cached locally yet.
     */
    Optional<String> storageAccountKey();

    /**
     * Name of the backup file as seen by the database engine inside its backup directory.
     */
    String fileName();

    String localDirectory();

    String protocolVersion();

    int downloadBufferSize();

    Duration connectTimeout();

    /**
     * Maximum time to wait for the next chunk of the response body.
     */
    Duration readTimeout();
}
