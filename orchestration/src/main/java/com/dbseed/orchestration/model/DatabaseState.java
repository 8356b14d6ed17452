package com.dbseed.orchestration.model;

public enum DatabaseState {
    ABSENT,
    PRESENT_EMPTY,
    PRESENT_POPULATED
}
