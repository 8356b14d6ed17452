package com.dbseed.orchestration.model;

import lombok.Value;

@Value
public class DownloadProgress {
    long bytesTransferred;
    /**
     * Declared content length, -1 if unknown.
     */
    long totalBytes;
    int percentage;
}
