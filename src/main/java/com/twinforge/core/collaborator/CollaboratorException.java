package com.twinforge.core.collaborator;

/**
 * A collaborator call failed or returned something unusable.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
