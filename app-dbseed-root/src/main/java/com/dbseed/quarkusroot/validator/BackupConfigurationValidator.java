package com.dbseed.quarkusroot.validator;

import com.dbseed.configuration.properties.constant.DbSeedConstants;
import com.dbseed.configuration.properties.predefined.BackupProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.net.URI;

@Slf4j
@ApplicationScoped
public class BackupConfigurationValidator implements ConfigurationValidator {

    @Inject
    BackupProperties backupProperties;

    @Override
    public boolean validate() {
        boolean flag = true;

        if (!validateFileUrl(backupProperties.fileUrl())) {
            flag = false;
        }

        String fileName = backupProperties.fileName();
        if (fileName == null || !DbSeedConstants.BACKUP_FILE_NAME_PATTERN.matcher(fileName).matches()) {
            log.error("Invalid configuration. Backup file name '{}' must contain only letters, digits, '.', '_' and '-'.", fileName);
            flag = false;
        }

        if (StringUtils.isBlank(backupProperties.localDirectory())) {
            log.error("Invalid configuration. Local backup directory must not be empty.");
            flag = false;
        }

        if (backupProperties.downloadBufferSize() <= 0) {
            log.error("Invalid configuration. Download buffer size must be positive.");
            flag = false;
        }

        if (backupProperties.storageAccountKey().filter(StringUtils::isNotBlank).isEmpty()) {
            log.warn("Storage account key is not configured. Backup can only be used if it is already cached locally.");
        }

        return flag;
    }

    private boolean validateFileUrl(String fileUrl) {
        URI uri;
        try {
            uri = URI.create(fileUrl);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.error("Invalid configuration. Backup file URL '{}' is malformed.", fileUrl);
            return false;
        }

        if (!"https".equalsIgnoreCase(uri.getScheme()) && !"http".equalsIgnoreCase(uri.getScheme())) {
            log.error("Invalid configuration. Backup file URL must use http or https scheme.");
            return false;
        }

        if (StringUtils.isEmpty(uri.getHost())) {
            log.error("Invalid configuration. Backup file URL must contain storage account host.");
            return false;
        }

        String path = StringUtils.strip(uri.getRawPath(), "/");
        if (StringUtils.isEmpty(path) || !path.contains("/")) {
            log.error("Invalid configuration. Backup file URL must contain share name and file path.");
            return false;
        }

        return true;
    }
}
