package com.dbseed.orchestration.model;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable progress of a single orchestration run. Confined to the orchestrating thread.
 */
@Slf4j
public class RestoreRun {
    @Getter
    private final SqlIdentifier databaseName;
    private final List<RestoreState> history = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    @Getter
    private RestoreState state;
    @Getter
    private int dropAttempts;

    public RestoreRun(SqlIdentifier databaseName) {
        this.databaseName = databaseName;
    }

    public void transitionTo(RestoreState newState) {
        if (state != null && state.isTerminal()) {
            throw new IllegalStateException("Restore run for " + databaseName + " already finished in state " + state);
        }
        log.debug("Restore of {} moves from {} to {}", databaseName, state, newState);
        state = newState;
        history.add(newState);
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void incrementDropAttempts() {
        dropAttempts++;
    }

    public List<RestoreState> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public RestoreResult finish(RestoreOutcome outcome, Throwable failure) {
        transitionTo(outcome == RestoreOutcome.FAILED ? RestoreState.FAILED : RestoreState.DONE);
        return RestoreResult.builder()
                .databaseName(databaseName)
                .finalState(state)
                .outcome(outcome)
                .history(List.copyOf(history))
                .warnings(List.copyOf(warnings))
                .dropAttempts(dropAttempts)
                .failure(failure)
                .build();
    }
}
