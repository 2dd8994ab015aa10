package com.twinforge.core.model;

import java.io.Serializable;
import java.time.Duration;

/**
 * Per-run budgets and execution options. Immutable once a run starts.
 *
 * @param maxIterations            top-level Plan/Build/Judge iterations allowed
 * @param backendMaxSubIterations  Coding/Verifying cycles allowed for the backend
 * @param frontendMaxSubIterations Coding/Verifying cycles allowed for the frontend
 * @param parallel                 run required targets concurrently, otherwise one after another
 * @param collaboratorTimeout      upper bound for every collaborator call
 * @param planningAttempts         planning calls per iteration before PlanningFailed (1 = no retry)
 * @param planningBackoff          wait before the second planning attempt, doubled afterwards
 */
public record RunConfig(
    int maxIterations,
    int backendMaxSubIterations,
    int frontendMaxSubIterations,
    boolean parallel,
    Duration collaboratorTimeout,
    int planningAttempts,
    Duration planningBackoff
) implements Serializable {

    public static final int ITERATION_CEILING = 50;

    public RunConfig {
        if (maxIterations < 1 || maxIterations > ITERATION_CEILING) {
            throw new IllegalArgumentException(
                    "maxIterations must be between 1 and " + ITERATION_CEILING + ", was " + maxIterations);
        }
        if (backendMaxSubIterations < 1) {
            throw new IllegalArgumentException("backendMaxSubIterations must be >= 1, was " + backendMaxSubIterations);
        }
        if (frontendMaxSubIterations < 1) {
            throw new IllegalArgumentException("frontendMaxSubIterations must be >= 1, was " + frontendMaxSubIterations);
        }
        if (collaboratorTimeout == null || collaboratorTimeout.isNegative() || collaboratorTimeout.isZero()) {
            throw new IllegalArgumentException("collaboratorTimeout must be positive");
        }
        if (planningAttempts < 1) {
            throw new IllegalArgumentException("planningAttempts must be >= 1, was " + planningAttempts);
        }
        if (planningBackoff == null || planningBackoff.isNegative()) {
            planningBackoff = Duration.ZERO;
        }
    }

    public static RunConfig defaults() {
        return new RunConfig(10, 2, 2, true, Duration.ofSeconds(180), 1, Duration.ofSeconds(2));
    }

    public int maxSubIterations(Target target) {
        return target == Target.BACKEND ? backendMaxSubIterations : frontendMaxSubIterations;
    }

    public RunConfig withMaxIterations(int value) {
        return new RunConfig(value, backendMaxSubIterations, frontendMaxSubIterations, parallel,
                collaboratorTimeout, planningAttempts, planningBackoff);
    }

    public RunConfig withMaxSubIterations(int backend, int frontend) {
        return new RunConfig(maxIterations, backend, frontend, parallel,
                collaboratorTimeout, planningAttempts, planningBackoff);
    }

    public RunConfig withParallel(boolean value) {
        return new RunConfig(maxIterations, backendMaxSubIterations, frontendMaxSubIterations, value,
                collaboratorTimeout, planningAttempts, planningBackoff);
    }
}
