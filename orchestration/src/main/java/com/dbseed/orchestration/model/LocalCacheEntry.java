package com.dbseed.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Local copy of a backup. Existing entry is trusted to be complete, files are only ever moved into place after a finished download.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocalCacheEntry {
    private Path localPath;
    private boolean exists;
    private Long sizeBytes;

    public static LocalCacheEntry missing(Path localPath) {
        return new LocalCacheEntry(localPath, false, null);
    }
}
