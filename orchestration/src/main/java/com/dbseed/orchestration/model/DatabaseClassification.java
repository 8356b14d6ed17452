package com.dbseed.orchestration.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatabaseClassification {
    private DatabaseState state;
    /**
     * Number of user tables. Zero if database is absent.
     */
    private int tableCount;
}
