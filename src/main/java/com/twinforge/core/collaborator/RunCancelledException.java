package com.twinforge.core.collaborator;

/**
 * Raised when a stop request is observed at a suspension point.
 */
public class RunCancelledException extends RuntimeException {

    public RunCancelledException(String runId) {
        super("Run " + runId + " was stopped");
    }
}
