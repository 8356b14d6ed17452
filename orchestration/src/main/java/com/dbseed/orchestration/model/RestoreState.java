package com.dbseed.orchestration.model;

public enum RestoreState {
    FETCHING,
    PROBING,
    RECLAIMING,
    DROPPING,
    RESTORING,
    FINALIZING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
