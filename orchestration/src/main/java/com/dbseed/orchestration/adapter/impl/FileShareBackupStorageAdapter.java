package com.dbseed.orchestration.adapter.impl;

import com.dbseed.configuration.exception.OperationCancelledException;
import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.configuration.properties.predefined.BackupProperties;
import com.dbseed.orchestration.adapter.api.BackupStorageAdapter;
import com.dbseed.orchestration.adapter.api.DownloadProgressListener;
import com.dbseed.orchestration.constant.FileShareConstants;
import com.dbseed.orchestration.exception.DownloadException;
import com.dbseed.orchestration.exception.MissingCredentialException;
import com.dbseed.orchestration.model.BackupSource;
import com.dbseed.orchestration.model.DownloadProgress;
import com.dbseed.orchestration.model.LocalCacheEntry;
import com.dbseed.orchestration.restclient.FileShareTemplateRestClient;
import com.dbseed.orchestration.util.DynamicRestClientUtils;
import com.dbseed.orchestration.util.SharedKeySigner;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Downloads backups from Azure file share using Shared Key authorization.
 */
@Slf4j
@ApplicationScoped
public class FileShareBackupStorageAdapter implements BackupStorageAdapter {

    @Inject
    BackupProperties backupProperties;

    @Inject
    DynamicRestClientUtils dynamicRestClientUtils;

    Clock clock = Clock.systemUTC();

    @Override
    public LocalCacheEntry ensureLocal(BackupSource source, Path destPath, DownloadProgressListener progressListener, CancellationToken cancellationToken) {
        String fileName = destPath.getFileName().toString();

        if (Files.exists(destPath)) {
            log.info("{} already exists locally at {}", fileName, destPath);
            return LocalCacheEntry.builder().localPath(destPath).exists(true).sizeBytes(sizeOrNull(destPath)).build();
        }

        if (StringUtils.isEmpty(source.getSigningKey())) {
            throw new MissingCredentialException("Storage account key is required to download " + fileName + " from file share.");
        }

        cancellationToken.throwIfCancellationRequested();

        String date = FileShareConstants.RFC_1123_FORMATTER.format(clock.instant());
        String protocolVersion = backupProperties.protocolVersion();
        String authorization = createAuthorization(source, date, protocolVersion);
        Path tempPath = destPath.resolveSibling(fileName + FileShareConstants.TEMPORARY_FILE_SUFFIX);
        AtomicReference<InputStream> bodyReference = new AtomicReference<>();

        log.info("Downloading {} from file share...", fileName);

        FileShareTemplateRestClient restClient = null;
        Response response = null;

        try (CancellationToken.Registration ignored = cancellationToken.register(() -> IOUtils.closeQuietly(bodyReference.get()))) {
            restClient = dynamicRestClientUtils.createRestClient(
                    FileShareTemplateRestClient.class,
                    URI.create(source.getSourceUrl()),
                    backupProperties.connectTimeout(),
                    backupProperties.readTimeout()
            );
            response = restClient.getFile(date, protocolVersion, authorization);
            cancellationToken.throwIfCancellationRequested();

            if (response.getStatus() < 200 || response.getStatus() >= 300) {
                String errorContent = response.hasEntity() ? response.readEntity(String.class) : "";
                log.error("Failed to download {}: {} - {}", fileName, response.getStatus(), errorContent);
                return LocalCacheEntry.missing(destPath);
            }

            long totalBytes = NumberUtils.toLong(response.getHeaderString(HttpHeaders.CONTENT_LENGTH), -1L);
            if (totalBytes >= 0) {
                log.info("Total file size: {} MB", toMegabytes(totalBytes));
            }

            InputStream body = response.readEntity(InputStream.class);
            bodyReference.set(body);
            cancellationToken.throwIfCancellationRequested();

            Files.createDirectories(destPath.toAbsolutePath().getParent());
            long bytesRead = streamToFile(body, tempPath, totalBytes, progressListener, cancellationToken);

            if (totalBytes >= 0 && bytesRead != totalBytes) {
                throw new DownloadException("Download of " + fileName + " ended after " + bytesRead + " of " + totalBytes + " bytes.");
            }

            moveIntoPlace(tempPath, destPath);
            log.info("Downloaded {} successfully to {} ({} MB)", fileName, destPath, toMegabytes(bytesRead));

            return LocalCacheEntry.builder().localPath(destPath).exists(true).sizeBytes(bytesRead).build();
        } catch (ProcessingException | IOException e) {
            if (cancellationToken.isCancellationRequested()) {
                throw new OperationCancelledException("Download of " + fileName + " was cancelled.", e);
            }
            log.error("Error downloading {}: {}", fileName, e.getMessage());
            throw new DownloadException("Failed to download " + fileName, e);
        } finally {
            FileUtils.deleteQuietly(tempPath.toFile());
            if (response != null) {
                response.close();
            }
            dynamicRestClientUtils.closeClient(restClient);
        }
    }

    String createAuthorization(BackupSource source, String date, String protocolVersion) {
        return SharedKeySigner.createGetAuthorizationHeader(
                source.getAccountIdentifier(),
                source.getCanonicalizedResource(),
                date,
                protocolVersion,
                source.getSigningKey()
        );
    }

    private long streamToFile(InputStream body, Path tempPath, long totalBytes, DownloadProgressListener progressListener, CancellationToken cancellationToken) throws IOException {
        byte[] buffer = new byte[backupProperties.downloadBufferSize()];
        long totalBytesRead = 0;
        int lastReportedProgress = 0;

        try (InputStream contentStream = body;
             OutputStream fileStream = Files.newOutputStream(tempPath, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            int bytesRead;
            while ((bytesRead = contentStream.read(buffer)) != -1) {
                cancellationToken.throwIfCancellationRequested();
                fileStream.write(buffer, 0, bytesRead);
                totalBytesRead += bytesRead;

                if (totalBytes > 0) {
                    int progressPercentage = (int) ((totalBytesRead * 100) / totalBytes);
                    if (progressPercentage >= lastReportedProgress + 1) {
                        lastReportedProgress = progressPercentage;
                        progressListener.onProgress(new DownloadProgress(totalBytesRead, totalBytes, progressPercentage));
                    }
                }
            }
        }

        return totalBytesRead;
    }

    private void moveIntoPlace(Path tempPath, Path destPath) throws IOException {
        try {
            Files.move(tempPath, destPath, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move is not supported for {}, falling back to regular move.", destPath);
            Files.move(tempPath, destPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Long sizeOrNull(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            log.warn("Failed to read size of {}", path, e);
            return null;
        }
    }

    static String toMegabytes(long bytes) {
        return String.format("%.2f", bytes / (1024.0 * 1024.0));
    }
}
