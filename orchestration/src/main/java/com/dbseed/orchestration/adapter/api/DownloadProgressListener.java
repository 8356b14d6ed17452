package com.dbseed.orchestration.adapter.api;

import com.dbseed.orchestration.model.DownloadProgress;

/**
 * Receives download progress. Called on the downloading thread, at most once per percentage point of declared content length.
 */
@FunctionalInterface
public interface DownloadProgressListener {
    void onProgress(DownloadProgress progress);
}
