package com.cementtracker.delivery.model;

/**
 * Lifecycle of a sync session, one value per pipeline stage plus the two terminal states.
 */
public enum SyncState {
    IDLE,
    FETCHING,
    FILTERING,
    PARSING,
    RECONCILING,
    PERSISTING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
