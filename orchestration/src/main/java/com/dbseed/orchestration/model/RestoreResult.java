package com.dbseed.orchestration.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RestoreResult {
    SqlIdentifier databaseName;
    RestoreState finalState;
    RestoreOutcome outcome;
    List<RestoreState> history;
    List<String> warnings;
    int dropAttempts;
    Throwable failure;

    public boolean isSuccess() {
        return finalState == RestoreState.DONE;
    }

    public String getSummary() {
        StringBuilder builder = new StringBuilder()
                .append(databaseName).append(": ").append(finalState).append(" (").append(outcome).append(")");
        if (!warnings.isEmpty()) {
            builder.append(", warnings: ").append(String.join("; ", warnings));
        }
        if (failure != null) {
            builder.append(", cause: ").append(failure.getMessage());
        }
        return builder.toString();
    }
}
