package com.twinforge.core.collaborator;

/**
 * The planner could not produce a plan within its attempts. Fatal for the run.
 */
public class PlanningFailedException extends RuntimeException {

    private final int attempts;

    public PlanningFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
