package com.dbseed.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;

/**
 * One physical file stored inside a backup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupManifestEntry {
    private String logicalName;
    private StreamKind streamKind;

    @RequiredArgsConstructor
    public enum StreamKind {
        DATA(".mdf"),
        LOG("_log.ldf");

        @Getter
        private final String physicalFileSuffix;
    }
}
