package com.dbseed.orchestration.adapter.api;

import com.dbseed.configuration.exception.OperationCancelledException;
import com.dbseed.configuration.model.CancellationToken;
import com.dbseed.orchestration.exception.DownloadException;
import com.dbseed.orchestration.exception.InvalidCredentialException;
import com.dbseed.orchestration.exception.MissingCredentialException;
import com.dbseed.orchestration.model.BackupSource;
import com.dbseed.orchestration.model.LocalCacheEntry;

import java.nio.file.Path;

/**
 * Interface for remote storage holding the backup. Implementations materialize the backup as a local file exactly once.
 */
public interface BackupStorageAdapter {

    /**
     * Makes sure backup is present at destination path. If destination already exists, it is returned as-is without any remote call.
     * Otherwise, backup is downloaded to a temporary file which is moved to destination only after the whole body was received.
     *
     * @param source            remote backup
     * @param destPath          local cache file
     * @param progressListener  receives progress when content length is known
     * @param cancellationToken aborts in-flight download when cancelled
     * @return entry with {@code exists=true} when file is available locally, entry with {@code exists=false} if storage rejected the request
     * @throws MissingCredentialException  if download is required but source has no signing key
     * @throws InvalidCredentialException  if signing key is not valid base64
     * @throws DownloadException           if I/O failed while downloading
     * @throws OperationCancelledException if cancellation was requested
     */
    LocalCacheEntry ensureLocal(BackupSource source, Path destPath, DownloadProgressListener progressListener, CancellationToken cancellationToken);
}
