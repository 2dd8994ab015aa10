package com.twinforge.core.model;

/**
 * Lifecycle of a run. DELIVERED, FAILED and STOPPED are terminal.
 */
public enum RunStatus {
    CREATED,
    PLANNING,
    RUNNING,
    JUDGING,
    REPLANNING,
    DELIVERED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED || this == STOPPED;
    }
}
