package com.dbseed.orchestration.model;

public enum RestoreOutcome {
    SKIPPED_ALREADY_POPULATED,
    RESTORED,
    /**
     * Database restored, but finalization steps (trustworthy flag, owner) failed.
     */
    RESTORED_WITH_WARNINGS,
    FAILED
}
