package com.dbseed.orchestration.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class RestoreTarget {
    SqlIdentifier databaseName;
    @ToString.Exclude
    String connectionUrl;
}
