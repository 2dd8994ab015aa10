package com.twinforge.core.collaborator;

import java.time.Duration;

/**
 * A collaborator call did not finish within its timeout.
 */
public class CollaboratorTimeoutException extends CollaboratorException {

    private final Duration timeout;

    public CollaboratorTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
